package com.placement.repository;

import com.placement.exception.StoreUnavailableException;
import com.placement.model.InsertResult;
import com.placement.model.PlacementRecord;

import java.util.List;
import java.util.Optional;

/**
 * Document-store operations the reconciler depends on.
 *
 * Implementations throw {@link StoreUnavailableException} when the store cannot be
 * reached within their timeout and retry budget.
 */
public interface PlacementRecordStore {

    /**
     * Fails with {@link StoreUnavailableException} if the store is not reachable.
     */
    void ping();

    /**
     * All records whose company equals {@code company} exactly, newest {@code updatedAt} first.
     */
    List<PlacementRecord> findByCompany(String company);

    Optional<PlacementRecord> findById(String id);

    List<PlacementRecord> findAll();

    /**
     * Company names that have more than one record.
     */
    List<String> findDuplicateCompanies();

    /**
     * Inserts a new record. A missing id is assigned before the first attempt, so a retried
     * insert that already landed reports {@link InsertResult.Status#ALREADY_EXISTS}.
     */
    InsertResult insert(PlacementRecord record);

    /**
     * Replaces the record's roles, students and timestamps only if its stored version still
     * equals {@code expectedVersion}; the stored version is incremented on success.
     *
     * @return false when the record was modified (or removed) since it was read
     */
    boolean updateConditional(String id, long expectedVersion, PlacementRecord record);
}
