package com.logsink.intake.config;

import com.logsink.core.ingest.RecordNormalizer;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "logsink.intake")
public class IntakeProperties {

    @Min(1)
    private int maxTextLength = RecordNormalizer.DEFAULT_MAX_TEXT_LENGTH;

    /** Header carrying the tenant for text/plain submissions. */
    @NotBlank
    private String tenantHeader = "X-Tenant-ID";

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public String getTenantHeader() {
        return tenantHeader;
    }

    public void setTenantHeader(String tenantHeader) {
        this.tenantHeader = tenantHeader;
    }
}
