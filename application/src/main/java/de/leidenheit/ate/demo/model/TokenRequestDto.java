package de.leidenheit.ate.demo.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for a token.")
public class TokenRequestDto {

    @Schema(description = "SHA-1 of device_sn, os_platform, app_version and the shared secret.")
    private String sign;
}
