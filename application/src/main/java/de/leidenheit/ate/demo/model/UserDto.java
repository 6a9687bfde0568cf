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
@Schema(description = "A user.")
public class UserDto {

    @Schema(description = "Name of the user.")
    private String name;
    @Schema(description = "Password of the user.")
    private String password;
}
