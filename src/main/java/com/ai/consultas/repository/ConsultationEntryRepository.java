package com.ai.consultas.repository;

import com.ai.consultas.entity.ConsultationEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConsultationEntryRepository extends JpaRepository<ConsultationEntry, Long> {

    List<ConsultationEntry> findByCourseCodeOrderByReceivedAtAsc(String courseCode);
}
