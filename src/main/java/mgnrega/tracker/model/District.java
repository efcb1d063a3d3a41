package mgnrega.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "districts")
public class District {
    @Id
    private String id;
    private String stateCode;
    private String stateName;
    private String districtName; // Bilingual, e.g. "पुणे (Pune)"
    private String districtCode;
    private Instant createdAt;
}
