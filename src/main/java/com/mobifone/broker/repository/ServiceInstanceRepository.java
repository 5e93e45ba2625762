package com.mobifone.broker.repository;

import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.InstanceState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceInstanceRepository extends JpaRepository<ServiceInstance, String> {

    Optional<ServiceInstance> findFirstByUser_IdAndLogicalService_IdAndStateIn(
            String userId, String serviceId, Collection<InstanceState> states);

    List<ServiceInstance> findByLogicalService_IdAndUserIsNullAndState(String serviceId, InstanceState state);

    long countByLogicalService_IdAndStateIn(String serviceId, Collection<InstanceState> states);

    List<ServiceInstance> findByLogicalService_IdOrderByAssignedAtDesc(String serviceId);

    List<ServiceInstance> findByUser_IdAndStateIn(String userId, Collection<InstanceState> states);

    Optional<ServiceInstance> findFirstByBackendRef(String backendRef);

    /** Takes a pooled instance for a user; 0 rows means someone else got it first. */
    @Transactional
    @Modifying
    @Query("""
    update ServiceInstance si
       set si.user = :user, si.assignmentKey = :assignmentKey, si.assignedAt = :now
     where si.id = :id and si.user is null
    """)
    int claim(@Param("id") String id,
              @Param("user") User user,
              @Param("assignmentKey") String assignmentKey,
              @Param("now") Instant now);

    /** Moves an instance between states; 0 rows means it was no longer in {@code from}. */
    @Transactional
    @Modifying
    @Query("""
    update ServiceInstance si
       set si.state = :to, si.version = si.version + 1
     where si.id = :id and si.state = :from
    """)
    int transition(@Param("id") String id,
                   @Param("from") InstanceState from,
                   @Param("to") InstanceState to);

    @Transactional
    @Modifying
    @Query("""
    update ServiceInstance si
       set si.address = :address, si.version = si.version + 1
     where si.id = :id and si.state = :state
    """)
    int recordAddress(@Param("id") String id,
                      @Param("address") String address,
                      @Param("state") InstanceState state);

    /** Frees the assignment slot of an active instance; 0 rows means it was already released. */
    @Transactional
    @Modifying
    @Query("""
    update ServiceInstance si
       set si.state = :removing, si.assignmentKey = null, si.version = si.version + 1
     where si.id = :id and si.state in :active
    """)
    int retire(@Param("id") String id,
               @Param("removing") InstanceState removing,
               @Param("active") Collection<InstanceState> active);

    @Transactional
    @Modifying
    @Query("update ServiceInstance si set si.srcIp = :ip, si.srcHostname = :hostname where si.id = :id")
    int updateConnectionSource(@Param("id") String id,
                               @Param("ip") String ip,
                               @Param("hostname") String hostname);
}
