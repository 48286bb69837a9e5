package com.flagship.transfer_engine.transfer;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransferRepository extends JpaRepository<TransferEntity, UUID> {

    /**
     * Loads a transfer and holds its row lock until the transaction ends.
     * Two decisions on the same transfer serialize here; the second sees the first's status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransferEntity t WHERE t.id = :id")
    Optional<TransferEntity> findByIdForUpdate(@Param("id") UUID id);
}
