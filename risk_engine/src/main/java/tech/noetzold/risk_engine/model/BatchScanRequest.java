package tech.noetzold.risk_engine.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchScanRequest {
    @NotEmpty
    private List<@Valid ScanRequest> apps;

    private DeviceIntegrityEvidence deviceIntegrity;

    /** Also report packages that have a baseline but were not part of this batch. */
    private boolean reportRemoved;
}
