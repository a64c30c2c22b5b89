package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.entity.AccidentZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AccidentZoneRepository extends JpaRepository<AccidentZone, String> {

    List<AccidentZone> findByActiveTrue();

    long countByActiveTrue();
}
