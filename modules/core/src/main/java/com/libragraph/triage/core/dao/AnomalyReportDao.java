package com.libragraph.triage.core.dao;

import com.libragraph.triage.core.anomaly.ReportRow;
import com.libragraph.triage.types.RiskLevel;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Insert-only: reports are snapshots and have no update statement.
 */
@RegisterConstructorMapper(ReportRow.class)
public interface AnomalyReportDao {

    @SqlUpdate("INSERT INTO anomaly_report (case_id, anomalies_detected, total_activities, model_accuracy, " +
            "risk_level, overall_risk_score, scorer, job_id, body, generated_at) " +
            "VALUES (:caseId, :anomalies, :total, :accuracy, :riskLevel, :riskScore, :scorer, :jobId, :body, " +
            ":generatedAt)")
    @GetGeneratedKeys("id")
    long insert(@Bind("caseId") String caseId,
                @Bind("anomalies") int anomalies,
                @Bind("total") int total,
                @Bind("accuracy") double accuracy,
                @Bind("riskLevel") RiskLevel riskLevel,
                @Bind("riskScore") double riskScore,
                @Bind("scorer") String scorer,
                @Bind("jobId") Long jobId,
                @Bind("body") String body,
                @Bind("generatedAt") Instant generatedAt);

    @SqlQuery("SELECT id, body FROM anomaly_report WHERE case_id = :caseId ORDER BY id DESC LIMIT 1")
    Optional<ReportRow> findLatest(@Bind("caseId") String caseId);

    @SqlQuery("SELECT id, body FROM anomaly_report WHERE case_id = :caseId AND id = :id")
    Optional<ReportRow> findById(@Bind("caseId") String caseId, @Bind("id") long id);

    @SqlQuery("SELECT id, body FROM anomaly_report WHERE case_id = :caseId ORDER BY id")
    List<ReportRow> findByCase(@Bind("caseId") String caseId);

    @SqlQuery("SELECT COUNT(*) FROM anomaly_report WHERE case_id = :caseId")
    int count(@Bind("caseId") String caseId);
}
