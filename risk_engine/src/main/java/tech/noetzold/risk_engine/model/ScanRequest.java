package tech.noetzold.risk_engine.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {
    @NotNull
    @Valid
    private ScannedAppEvidence app;

    /** Falls back to the batch-level value, then to unknown. */
    private DeviceIntegrityEvidence deviceIntegrity;

    private SpecialAccessSnapshot specialAccess;
}
