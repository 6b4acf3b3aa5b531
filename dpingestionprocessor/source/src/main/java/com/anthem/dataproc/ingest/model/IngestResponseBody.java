package com.anthem.dataproc.ingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResponseBody {

    private String message;

    private String error;

    private Integer recordsWritten;

    private List<FailureDetail> failures;

    public static IngestResponseBody error(String error) {
        return IngestResponseBody.builder().error(error).build();
    }

    public static List<FailureDetail> details(List<RecordFailure> failures) {
        return failures.stream().map(FailureDetail::from).collect(Collectors.toList());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailureDetail {
        private String recordId;
        private String content;
        private String cause;

        static FailureDetail from(RecordFailure failure) {
            return new FailureDetail(failure.getRecord().getId(), failure.getRecord().getContent(), failure.getCause());
        }
    }
}
