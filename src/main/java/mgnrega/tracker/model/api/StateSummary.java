package mgnrega.tracker.model.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateSummary {
    private String stateCode;
    private String stateName;
}
