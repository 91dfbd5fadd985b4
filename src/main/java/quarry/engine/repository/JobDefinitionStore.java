package quarry.engine.repository;

import quarry.engine.model.JobDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for job definitions.
 */
public interface JobDefinitionStore {

    /**
     * Insert or replace a definition.
     *
     * @param definition the definition to save
     */
    void save(JobDefinition definition);

    /**
     * Find a definition by ID.
     *
     * @param id the definition ID
     * @return the definition if found
     */
    Optional<JobDefinition> findById(String id);

    /**
     * All definitions ordered by id.
     *
     * @return list of definitions
     */
    List<JobDefinition> findAll();

    /**
     * Delete a definition.
     *
     * @param id the definition ID
     * @return true if deleted
     */
    boolean delete(String id);
}
