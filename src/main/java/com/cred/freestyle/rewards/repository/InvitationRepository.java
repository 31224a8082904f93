package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.Invitation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for invitation edges.
 *
 * @author Rewards Team
 */
@Repository
public interface InvitationRepository extends JpaRepository<Invitation, String> {

    Optional<Invitation> findByInviteeId(String inviteeId);

    boolean existsByInviteeId(String inviteeId);

    /**
     * Find an invitation with a write lock; claims on one edge serialize here.
     *
     * @param invitationId Invitation ID
     * @return Optional containing the locked invitation if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invitation i WHERE i.invitationId = :invitationId")
    Optional<Invitation> findByIdForUpdate(@Param("invitationId") String invitationId);
}
