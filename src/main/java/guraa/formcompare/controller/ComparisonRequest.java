package guraa.formcompare.controller;

import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonRequest {

    @Builder.Default
    private List<FieldRecord> sourceFields = new ArrayList<>();

    @Builder.Default
    private List<FieldRecord> targetFields = new ArrayList<>();

    private DocumentMetadata sourceMetadata;
    private DocumentMetadata targetMetadata;
}
