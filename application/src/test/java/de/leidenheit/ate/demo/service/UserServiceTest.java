package de.leidenheit.ate.demo.service;

import de.leidenheit.ate.demo.model.UserDto;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserServiceTest {

    private final UserService userService = new UserService();

    @Test
    void shouldCreateUserOnlyOnce() {
        // given
        var user = UserDto.builder().name("user1").password("123456").build();

        // when
        var first = userService.create(1000, user);
        var second = userService.create(1000, UserDto.builder().name("other").build());

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(userService.find(1000)).hasValue(user);
    }

    @Test
    void shouldNotExposeStoredInstances() {
        // given
        var user = UserDto.builder().name("user1").password("123456").build();
        userService.create(1, user);

        // when
        user.setName("changed");
        userService.find(1).orElseThrow().setPassword("changed");

        // then
        assertThat(userService.find(1)).hasValue(UserDto.builder().name("user1").password("123456").build());
    }

    @Test
    void shouldUpdateAndDeleteExistingUsersOnly() {
        // given
        userService.create(1, UserDto.builder().name("a").build());
        userService.create(2, UserDto.builder().name("b").build());

        // when & then
        assertThat(userService.update(1, UserDto.builder().name("a2").build())).isTrue();
        assertThat(userService.update(3, UserDto.builder().name("c").build())).isFalse();
        assertThat(userService.delete(2)).isTrue();
        assertThat(userService.delete(2)).isFalse();
        assertThat(userService.findAll()).extracting(UserDto::getName).containsExactly("a2");

        userService.deleteAll();
        assertThat(userService.findAll()).isEmpty();
    }
}
