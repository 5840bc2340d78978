package com.fotoreport.backend.modules.report.infrastructure.persistence;

import java.util.List;

import com.fotoreport.backend.modules.report.domain.Photo;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PhotoRepository extends JpaRepository<Photo, Long> {

    List<Photo> findByReportIdOrderByIdAsc(Long reportId);

    long countByReportId(Long reportId);
}
