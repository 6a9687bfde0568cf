package de.leidenheit.ate.demo.controller;

import de.leidenheit.ate.demo.model.MessageDto;
import de.leidenheit.ate.demo.model.TokenDto;
import de.leidenheit.ate.demo.model.TokenRequestDto;
import de.leidenheit.ate.demo.service.TokenService;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@OpenAPIDefinition(
        info = @Info(
                description = "A demo API to run testsets against.",
                title = "ate demo API"),
        servers = {
                @Server(description = "Local", url = "http://localhost:8080")})
@RestController
@RequestMapping("/api")
public class TokenApi {

    private final TokenService tokenService;

    public TokenApi(final TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Operation(
            operationId = "getToken",
            summary = "Issues a token for a device",
            parameters = {
                    @Parameter(name = "device_sn", description = "Serial number of the device.", in = ParameterIn.HEADER),
                    @Parameter(name = "os_platform", description = "Platform of the device.", in = ParameterIn.HEADER),
                    @Parameter(name = "app_version", description = "Version of the app.", in = ParameterIn.HEADER)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Here is the token.",
                            content = @Content(
                                    schema = @Schema(implementation = TokenDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(
                            responseCode = "403",
                            description = "The sign does not match.",
                            content = @Content(
                                    schema = @Schema(implementation = MessageDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    )
            }
    )
    @PostMapping("/get-token")
    public ResponseEntity<TokenDto> getToken(@RequestHeader("device_sn") final String deviceSn,
                                             @RequestHeader("os_platform") final String osPlatform,
                                             @RequestHeader("app_version") final String appVersion,
                                             @RequestBody final TokenRequestDto tokenRequest) {
        var token = tokenService.issueToken(deviceSn, osPlatform, appVersion, tokenRequest.getSign());
        return ResponseEntity.ok(TokenDto.builder()
                .success(true)
                .token(token)
                .build());
    }
}
