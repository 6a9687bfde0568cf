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
@Schema(description = "Outcome of an operation.")
public class MessageDto {

    private boolean success;
    private String msg;

    public static MessageDto of(final boolean success, final String msg) {
        return MessageDto.builder()
                .success(success)
                .msg(msg)
                .build();
    }
}
