package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.AuditTrail;
import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.dto.SheetTable;
import com.bmsedge.sellout.exception.StructuralValidationException;
import com.bmsedge.sellout.profile.DateStrategy;
import com.bmsedge.sellout.profile.SourceProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Service
public class QualityGate {

    private static final Logger logger = LoggerFactory.getLogger(QualityGate.class);

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    /**
     * Rejects a table in which none of the profile's columns can be found.
     */
    public void verifyStructure(SheetTable table, SourceProfile profile) {
        if (RowCleaner.resolveColumns(table, profile).isEmpty()) {
            throw new StructuralValidationException("None of the columns expected for source '"
                    + profile.getSourceId() + "' were found in sheet '" + table.getSheetName()
                    + "' (headers: " + table.getHeaders() + ")");
        }
    }

    /**
     * Returns the candidates that fit the canonical schema. Failures are dropped
     * into the audit trail, never thrown.
     */
    public List<CanonicalEntry> evaluate(List<CanonicalEntry> candidates, AuditTrail trail) {
        List<CanonicalEntry> accepted = new ArrayList<>(candidates.size());
        for (CanonicalEntry entry : candidates) {
            String violation = firstViolation(entry);
            if (violation == null) {
                accepted.add(entry);
            } else {
                int row = entry.getSourceRow() == null ? -1 : entry.getSourceRow();
                trail.drop(row, null, null, violation);
            }
        }
        if (accepted.size() < candidates.size()) {
            logger.warn("Quality gate rejected {} of {} entries", candidates.size() - accepted.size(), candidates.size());
        }
        return accepted;
    }

    private String firstViolation(CanonicalEntry entry) {
        if (entry.getUploadId() == null || entry.getUploadId().isBlank()) return "missing_upload_id";
        if (entry.getReseller() == null || entry.getReseller().isBlank()) return "missing_reseller";
        if (entry.getCurrency() == null || !CURRENCY.matcher(entry.getCurrency()).matches()) return "invalid_currency";
        if (entry.getMonth() == null || entry.getMonth() < 1 || entry.getMonth() > 12) return "invalid_month";
        if (entry.getYear() == null || entry.getYear() < DateStrategy.MIN_YEAR) return "invalid_year";
        if (entry.getQuantity() == null) return "missing_quantity";
        return null;
    }
}
