package tech.noetzold.risk_engine.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemovedAppsRequest {
    @NotNull
    private Set<String> currentPackages;
}
