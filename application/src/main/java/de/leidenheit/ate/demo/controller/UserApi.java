package de.leidenheit.ate.demo.controller;

import de.leidenheit.ate.demo.model.MessageDto;
import de.leidenheit.ate.demo.model.UserDto;
import de.leidenheit.ate.demo.model.UserResponseDto;
import de.leidenheit.ate.demo.model.UsersDto;
import de.leidenheit.ate.demo.service.TokenService;
import de.leidenheit.ate.demo.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * User endpoints. Every request must carry the {@code device_sn} and {@code token} headers of a
 * previously issued token.
 */
@RestController
@RequestMapping("/api")
public class UserApi {

    private static final String HEADER_DEVICE_SN = "device_sn";
    private static final String HEADER_TOKEN = "token";

    private final TokenService tokenService;
    private final UserService userService;

    public UserApi(final TokenService tokenService, final UserService userService) {
        this.tokenService = tokenService;
        this.userService = userService;
    }

    @Operation(
            operationId = "findUsers",
            summary = "Returns all users",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "All users.",
                            content = @Content(
                                    schema = @Schema(implementation = UsersDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(responseCode = "403", description = "Authorization failed.")
            }
    )
    @GetMapping("/users")
    public ResponseEntity<UsersDto> findUsers(@RequestHeader(value = HEADER_DEVICE_SN, required = false) final String deviceSn,
                                              @RequestHeader(value = HEADER_TOKEN, required = false) final String token) {
        tokenService.verify(deviceSn, token);
        var users = userService.findAll();
        return ResponseEntity.ok(UsersDto.builder()
                .success(true)
                .count(users.size())
                .items(users)
                .build());
    }

    @Operation(
            operationId = "createUser",
            summary = "Creates a user",
            parameters = {
                    @Parameter(name = "id", description = "Id of the user.", in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "201",
                            description = "User created.",
                            content = @Content(
                                    schema = @Schema(implementation = MessageDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(responseCode = "403", description = "Authorization failed."),
                    @ApiResponse(responseCode = "409", description = "User already exists.")
            }
    )
    @PostMapping("/users/{id}")
    public ResponseEntity<MessageDto> createUser(@RequestHeader(value = HEADER_DEVICE_SN, required = false) final String deviceSn,
                                                 @RequestHeader(value = HEADER_TOKEN, required = false) final String token,
                                                 @PathVariable("id") final long id,
                                                 @RequestBody final UserDto user) {
        tokenService.verify(deviceSn, token);
        if (userService.create(id, user)) {
            return ResponseEntity.status(HttpStatus.CREATED).body(MessageDto.of(true, "user created successfully."));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(MessageDto.of(false, "user already existed."));
    }

    @Operation(
            operationId = "findUser",
            summary = "Returns a user by its id",
            parameters = {
                    @Parameter(name = "id", description = "Id of the user.", in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Here is the user.",
                            content = @Content(
                                    schema = @Schema(implementation = UserResponseDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(responseCode = "403", description = "Authorization failed."),
                    @ApiResponse(responseCode = "404", description = "User not found.")
            }
    )
    @GetMapping("/users/{id}")
    public ResponseEntity<?> findUser(@RequestHeader(value = HEADER_DEVICE_SN, required = false) final String deviceSn,
                                      @RequestHeader(value = HEADER_TOKEN, required = false) final String token,
                                      @PathVariable("id") final long id) {
        tokenService.verify(deviceSn, token);
        return userService.find(id)
                .<ResponseEntity<?>>map(user -> ResponseEntity.ok(UserResponseDto.builder()
                        .success(true)
                        .data(user)
                        .build()))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(MessageDto.of(false, "user not found.")));
    }

    @Operation(
            operationId = "updateUser",
            summary = "Replaces a user",
            parameters = {
                    @Parameter(name = "id", description = "Id of the user.", in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "User updated.",
                            content = @Content(
                                    schema = @Schema(implementation = MessageDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(responseCode = "403", description = "Authorization failed."),
                    @ApiResponse(responseCode = "404", description = "User not found.")
            }
    )
    @PutMapping("/users/{id}")
    public ResponseEntity<MessageDto> updateUser(@RequestHeader(value = HEADER_DEVICE_SN, required = false) final String deviceSn,
                                                 @RequestHeader(value = HEADER_TOKEN, required = false) final String token,
                                                 @PathVariable("id") final long id,
                                                 @RequestBody final UserDto user) {
        tokenService.verify(deviceSn, token);
        if (userService.update(id, user)) {
            return ResponseEntity.ok(MessageDto.of(true, "user updated successfully."));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(MessageDto.of(false, "user not found."));
    }

    @Operation(
            operationId = "deleteUser",
            summary = "Deletes a user",
            parameters = {
                    @Parameter(name = "id", description = "Id of the user.", in = ParameterIn.PATH)
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "User deleted.",
                            content = @Content(
                                    schema = @Schema(implementation = MessageDto.class),
                                    mediaType = MediaType.APPLICATION_JSON_VALUE)
                    ),
                    @ApiResponse(responseCode = "403", description = "Authorization failed."),
                    @ApiResponse(responseCode = "404", description = "User not found.")
            }
    )
    @DeleteMapping("/users/{id}")
    public ResponseEntity<MessageDto> deleteUser(@RequestHeader(value = HEADER_DEVICE_SN, required = false) final String deviceSn,
                                                 @RequestHeader(value = HEADER_TOKEN, required = false) final String token,
                                                 @PathVariable("id") final long id) {
        tokenService.verify(deviceSn, token);
        if (userService.delete(id)) {
            return ResponseEntity.ok(MessageDto.of(true, "user deleted successfully."));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(MessageDto.of(false, "user not found."));
    }

    @Operation(operationId = "resetAll", summary = "Deletes all users")
    @DeleteMapping("/reset-all")
    public ResponseEntity<MessageDto> resetAll(@RequestHeader(value = HEADER_DEVICE_SN, required = false) final String deviceSn,
                                               @RequestHeader(value = HEADER_TOKEN, required = false) final String token) {
        tokenService.verify(deviceSn, token);
        userService.deleteAll();
        return ResponseEntity.ok(MessageDto.of(true, "all users deleted."));
    }
}
