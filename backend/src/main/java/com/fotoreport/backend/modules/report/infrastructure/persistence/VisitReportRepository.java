package com.fotoreport.backend.modules.report.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;

import com.fotoreport.backend.modules.report.domain.ReportSummary;
import com.fotoreport.backend.modules.report.domain.VisitReport;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VisitReportRepository extends JpaRepository<VisitReport, Long> {

    @Query("""
            select new com.fotoreport.backend.modules.report.domain.ReportSummary(
                       r.id, r.visitDate, r.notes, l.id, l.siteName, l.siteCode, l.city, c.name, u.fullName)
              from VisitReport r
              join r.location l
              join l.client c
              join r.author u
             where u.id = :userId
               and r.visitDate between :from and :to
             order by r.visitDate desc, r.id desc
            """)
    List<ReportSummary> findAuthoredBetween(
            @Param("userId") Long userId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );

    @Query("""
            select new com.fotoreport.backend.modules.report.domain.ReportSummary(
                       r.id, r.visitDate, r.notes, l.id, l.siteName, l.siteCode, l.city, c.name, u.fullName)
              from VisitReport r
              join r.location l
              join l.client c
              join r.author u
             where r.visitDate between :from and :to
             order by r.visitDate desc, r.id desc
            """)
    List<ReportSummary> findAllBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("""
            select new com.fotoreport.backend.modules.report.domain.ReportSummary(
                       r.id, r.visitDate, r.notes, l.id, l.siteName, l.siteCode, l.city, c.name, u.fullName)
              from VisitReport r
              join r.location l
              join l.client c
              join r.author u
             where c.id = :clientId
               and r.visitDate between :from and :to
             order by r.visitDate, l.siteName, r.id
            """)
    List<ReportSummary> findForClientBetween(
            @Param("clientId") Long clientId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}
