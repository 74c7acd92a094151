package io.github.hongjungwan.auditlog.api.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * 로그 디렉토리 파일 통계. 디렉토리를 읽지 못하면 error만 채워진다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileStats(
        @JsonProperty("files_count") Integer filesCount,
        @JsonProperty("total_size") Long totalSize,
        @JsonProperty("total_size_mb") String totalSizeMb,
        @JsonProperty("error") String error
) {

    public static FileStats of(int filesCount, long totalSize) {
        String mb = String.format(Locale.ROOT, "%.2f", totalSize / 1024.0 / 1024.0);
        return new FileStats(filesCount, totalSize, mb, null);
    }

    public static FileStats failed(String error) {
        return new FileStats(null, null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
