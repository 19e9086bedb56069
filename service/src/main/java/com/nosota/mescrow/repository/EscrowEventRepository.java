package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.EscrowEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for the {@link EscrowEventRecord} journal.
 */
@Repository
public interface EscrowEventRepository extends JpaRepository<EscrowEventRecord, Long> {

    /**
     * Journal of one escrow in emission order.
     */
    List<EscrowEventRecord> findByProjectIdOrderByIdAsc(UUID projectId);

    /**
     * Total amount transferred out of the pool of an escrow (payouts and refunds).
     *
     * @param projectId The project ID
     * @return Sum of DISTRIBUTED amounts (or 0 if nothing was transferred)
     */
    @Query("""
            SELECT COALESCE(SUM(e.amount), 0)
            FROM EscrowEventRecord e
            WHERE e.projectId = :projectId
              AND e.type = com.nosota.mescrow.api.model.EscrowEventType.DISTRIBUTED
            """)
    Long sumDistributedAmount(@Param("projectId") UUID projectId);
}
