package tech.noetzold.risk_engine.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigCompareRequest {
    /** When absent the last snapshot seen by the engine is used. */
    private ConfigSnapshot previous;

    @NotNull
    private ConfigSnapshot current;
}
