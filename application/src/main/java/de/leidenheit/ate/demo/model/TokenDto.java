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
@Schema(description = "An issued token.")
public class TokenDto {

    private boolean success;
    @Schema(description = "Token to send in the 'token' header of user requests.")
    private String token;
}
