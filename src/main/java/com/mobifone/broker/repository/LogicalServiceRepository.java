package com.mobifone.broker.repository;

import com.mobifone.broker.entity.LogicalService;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LogicalServiceRepository extends JpaRepository<LogicalService, String> {

    @EntityGraph(attributePaths = {"transports", "groups"})
    Optional<LogicalService> findWithTransportsById(String id);

    @EntityGraph(attributePaths = {"transports"})
    @Query("""
    select distinct s from LogicalService s
    join s.groups g
    where s.enabled = true
      and g.id in :groupIds
    order by s.name
    """)
    List<LogicalService> findVisibleForGroups(@Param("groupIds") Collection<String> groupIds);
}
