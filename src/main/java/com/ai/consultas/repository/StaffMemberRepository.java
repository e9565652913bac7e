package com.ai.consultas.repository;

import com.ai.consultas.entity.StaffMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StaffMemberRepository extends JpaRepository<StaffMember, Long> {

    List<StaffMember> findByActiveTrueOrderByNameAsc();
}
