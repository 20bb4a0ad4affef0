package com.tau.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tau.backend.modules.auth.application.AuthErrorCode;
import com.tau.backend.modules.auth.application.AuthException;
import com.tau.backend.modules.auth.application.IssuedLoginLink;
import com.tau.backend.modules.auth.application.IssuedSession;
import com.tau.backend.modules.auth.application.LoginLinkService;
import com.tau.backend.modules.auth.application.PasswordHasher;
import com.tau.backend.modules.auth.application.SecretCodec;
import com.tau.backend.modules.auth.domain.Role;
import com.tau.backend.modules.auth.domain.TournamentRole;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.domain.UserSession;
import com.tau.backend.modules.auth.infrastructure.persistence.TournamentRoleRepository;
import com.tau.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.tau.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.tau.backend.support.AbstractPostgresIntegrationTest;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "correct horse battery";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private UserSessionRepository userSessionRepository;

    @Autowired
    private TournamentRoleRepository tournamentRoleRepository;

    @Autowired
    private PasswordHasher passwordHasher;

    @Autowired
    private SecretCodec secretCodec;

    @Autowired
    private LoginLinkService loginLinkService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM sessions");
        jdbcTemplate.update("DELETE FROM login_tokens");
        jdbcTemplate.update("DELETE FROM tournament_roles");
        jdbcTemplate.update("DELETE FROM tournaments");
        jdbcTemplate.update("DELETE FROM users WHERE id <> ?", User.INFRASTRUCTURE_ADMIN_ID);
    }

    private User createUser(String handle) {
        return userRepository.save(User.create(handle, passwordHasher.hash(PASSWORD)));
    }

    private static String basic(String login, String password) {
        String credentials = login + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String adminBasic() {
        return basic(User.INFRASTRUCTURE_ADMIN_HANDLE, INFRADMIN_PASSWORD);
    }

    private String login(String handle) throws Exception {
        return login(handle, PASSWORD);
    }

    private String login(String handle, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"login": "%s", "password": "%s"}
                                """.formatted(handle, password)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("token").asText();
    }

    private UUID createTournament() {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO tournaments (id, name) VALUES (?, ?)", id, "Spring Open");
        return id;
    }

    private void grantRole(User user, UUID tournamentId, Role role) {
        TournamentRole assignment = new TournamentRole();
        assignment.setUser(user);
        assignment.setTournamentId(tournamentId);
        assignment.setRole(role);
        tournamentRoleRepository.save(assignment);
    }

    @Test
    void infrastructureAdminIsBootstrapped() {
        User admin = userRepository.findById(User.INFRASTRUCTURE_ADMIN_ID).orElseThrow();

        assertThat(admin.getHandle()).isEqualTo("admin");
        assertThat(passwordHasher.verify(INFRADMIN_PASSWORD, admin.getPasswordHash())).isTrue();
    }

    @Test
    void passwordLoginIssuesUsableSessionAndCookie() throws Exception {
        createUser("jmanczak");

        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"login": "jmanczak", "password": "%s"}
                                """.formatted(PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.handle").value("jmanczak"))
                .andReturn();
        String token = objectMapper.readTree(result.getResponse().getContentAsString()).path("token").asText();

        assertThat(result.getResponse().getHeader(HttpHeaders.SET_COOKIE))
                .startsWith("tausession=" + token)
                .contains("HttpOnly")
                .contains("SameSite=Strict");
        assertThat(userSessionRepository.findByTokenHash(secretCodec.hashToken(token))).isPresent();

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handle").value("jmanczak"))
                .andExpect(header().exists(HttpHeaders.SET_COOKIE));

        mockMvc.perform(get("/users/me").cookie(new Cookie("tausession", token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.infrastructureAdmin").value(false));
    }

    @Test
    void basicCredentialsAuthenticateWithoutSession() throws Exception {
        createUser("jmanczak");

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, basic("jmanczak", PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handle").value("jmanczak"))
                .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, basic("jmanczak", "nope")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void credentialFailuresAreReportedAsProblems() throws Exception {
        mockMvc.perform(get("/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("NO_CREDENTIALS"));

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-session"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Digest foo=bar"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_HEADER_AUTH_SCHEME"));

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Digest"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_HEADER_AUTH_SCHEME_DATA"));
    }

    @Test
    void expiredSessionIsRejectedButKept() throws Exception {
        User user = createUser("late");
        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenHash(secretCodec.hashToken("stale-token"));
        session.setIssuedAt(OffsetDateTime.now().minusDays(10));
        session.setExpiresAt(OffsetDateTime.now().minusDays(3));
        userSessionRepository.save(session);

        mockMvc.perform(get("/users/me").cookie(new Cookie("tausession", "stale-token")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"));

        assertThat(userSessionRepository.findByTokenHash(secretCodec.hashToken("stale-token"))).isPresent();
    }

    @Test
    void loginLinkCanBeRedeemedExactlyOnce() throws Exception {
        User user = createUser("linked");

        MvcResult issued = mockMvc.perform(post("/users/{id}/login-link", user.getId())
                        .header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isCreated())
                .andReturn();
        String link = objectMapper.readTree(issued.getResponse().getContentAsString()).path("link").asText();
        assertThat(link).startsWith("/auth/login/");

        MvcResult redeemed = mockMvc.perform(get(link))
                .andExpect(status().isOk())
                .andExpect(header().exists(HttpHeaders.SET_COOKIE))
                .andReturn();
        String sessionToken = redeemed.getResponse().getContentAsString();

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + sessionToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handle").value("linked"));

        mockMvc.perform(get(link))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_ALREADY_USED"));

        mockMvc.perform(get("/auth/login/never-issued"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));
    }

    @Test
    void concurrentRedemptionsProduceOneSession() throws Exception {
        User user = createUser("racer");
        IssuedLoginLink link = loginLinkService.issue(user.getId());

        int attempts = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        List<Future<IssuedSession>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                Callable<IssuedSession> redeem = () -> {
                    start.await();
                    return loginLinkService.redeemForSession(link.rawToken());
                };
                futures.add(executor.submit(redeem));
            }
            start.countDown();

            int succeeded = 0;
            int alreadyUsed = 0;
            for (Future<IssuedSession> future : futures) {
                try {
                    future.get();
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(AuthException.class);
                    assertThat(((AuthException) ex.getCause()).getErrorCode()).isEqualTo(AuthErrorCode.TOKEN_ALREADY_USED);
                    alreadyUsed++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(alreadyUsed).isEqualTo(attempts - 1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM sessions WHERE user_id = ?", Integer.class, user.getId()))
                .isEqualTo(1);
    }

    @Test
    void onlyInfrastructureAdminIssuesLinks() throws Exception {
        User user = createUser("plain");

        mockMvc.perform(post("/users/{id}/login-link", user.getId())
                        .header(HttpHeaders.AUTHORIZATION, basic("plain", PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PERMISSIONS"));

        mockMvc.perform(post("/users/{id}/login-link", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }

    @Test
    void logoutDestroysSessionAndClearsCookie() throws Exception {
        createUser("leaver");
        String token = login("leaver");

        MvcResult result = mockMvc.perform(get("/auth/clear").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNoContent())
                .andReturn();
        assertThat(result.getResponse().getHeader(HttpHeaders.SET_COOKIE)).contains("Max-Age=0");

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));

        mockMvc.perform(get("/auth/clear"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_SESSION_TOKEN"));

        mockMvc.perform(get("/auth/clear")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer a")
                        .cookie(new Cookie("tausession", "b")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TOO_MANY_SESSION_TOKENS"));
    }

    @Test
    void passwordChangeReplacesAllSessions() throws Exception {
        User user = createUser("rotator");
        String first = login("rotator");
        String second = login("rotator");

        MvcResult result = mockMvc.perform(put("/users/me/password")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + first)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"currentPassword": "%s", "newPassword": "a much newer password"}
                                """.formatted(PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        String fresh = objectMapper.readTree(result.getResponse().getContentAsString()).path("token").asText();
        List<String> cookies = result.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
        assertThat(cookies).hasSize(1);
        assertThat(cookies.get(0)).startsWith("tausession=" + fresh);

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + first))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + second))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + fresh))
                .andExpect(status().isOk());
        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, basic("rotator", "a much newer password")))
                .andExpect(status().isOk());
        assertThat(userSessionRepository.findAllWithUser())
                .filteredOn(session -> session.getUser().getId().equals(user.getId()))
                .hasSize(1);
    }

    @Test
    void tournamentPermissionsFollowRoles() throws Exception {
        User judge = createUser("judy");
        createUser("outsider");
        UUID tournamentId = createTournament();
        grantRole(judge, tournamentId, Role.JUDGE);

        mockMvc.perform(get("/tournaments/{id}/permissions", tournamentId)
                        .header(HttpHeaders.AUTHORIZATION, basic("judy", PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roles[0]").value("JUDGE"))
                .andExpect(jsonPath("$.permissions.length()").value(5))
                .andExpect(jsonPath("$.permissions[?(@ == 'SUBMIT_OWN_VERDICT_VOTE')]").exists());

        mockMvc.perform(get("/tournaments/{id}/permissions", tournamentId)
                        .header(HttpHeaders.AUTHORIZATION, basic("outsider", PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roles").isEmpty())
                .andExpect(jsonPath("$.permissions").isEmpty());
    }

    @Test
    void userDeletionRules() throws Exception {
        User doomed = createUser("doomed");
        String doomedToken = login("doomed");
        User organizer = createUser("organizer");
        grantRole(organizer, createTournament(), Role.ORGANIZER);

        mockMvc.perform(delete("/users/{id}", User.INFRASTRUCTURE_ADMIN_ID)
                        .header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/users/{id}", organizer.getId())
                        .header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DEPENDENT_RESOURCES"));

        mockMvc.perform(delete("/users/{id}", doomed.getId())
                        .header(HttpHeaders.AUTHORIZATION, basic("organizer", PASSWORD)))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/users/{id}", doomed.getId())
                        .header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isNoContent());

        assertThat(userRepository.findById(doomed.getId())).isEmpty();
        assertThat(userSessionRepository.findByTokenHash(secretCodec.hashToken(doomedToken))).isEmpty();
        assertThat(userRepository.findById(organizer.getId())).isPresent();
    }

    @Test
    void infrastructureAdminEndpointsAreRestricted() throws Exception {
        createUser("nosy");
        login("nosy");

        mockMvc.perform(get("/infradmin/sessions").header(HttpHeaders.AUTHORIZATION, basic("nosy", PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PERMISSIONS"));

        mockMvc.perform(get("/infradmin/sessions").header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].handle").value("nosy"))
                .andExpect(jsonPath("$[0].token").doesNotExist());

        mockMvc.perform(get("/infradmin/all-users").header(HttpHeaders.AUTHORIZATION, adminBasic()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
    @Test
    void userUpdateRules() throws Exception {
        User alice = createUser("alice");
        createUser("bob");

        mockMvc.perform(patch("/users/{id}", alice.getId())
                        .header(HttpHeaders.AUTHORIZATION, basic("alice", PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"handle": "alicia", "profilePicture": "https://cdn.example.com/a/alicia.png"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handle").value("alicia"))
                .andExpect(jsonPath("$.profilePicture").value("https://cdn.example.com/a/alicia.png"));

        mockMvc.perform(patch("/users/{id}", alice.getId())
                        .header(HttpHeaders.AUTHORIZATION, basic("bob", PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\": \"stolen\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(patch("/users/{id}", alice.getId())
                        .header(HttpHeaders.AUTHORIZATION, basic("alicia", PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"handle\": \"bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("HANDLE_TAKEN"));

        mockMvc.perform(patch("/users/{id}", alice.getId())
                        .header(HttpHeaders.AUTHORIZATION, basic("alicia", PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"profilePicture\": \"https://cdn.example.com/a/alicia.gif\"}"))
                .andExpect(status().isBadRequest());

        User stored = userRepository.findById(alice.getId()).orElseThrow();
        assertThat(stored.getHandle()).isEqualTo("alicia");
        assertThat(stored.getProfilePicture().asString()).isEqualTo("https://cdn.example.com/a/alicia.png");
    }

    @Test
    void passwordResetThroughUpdateEndsSessions() throws Exception {
        User user = createUser("forgetful");
        String token = login("forgetful");

        mockMvc.perform(patch("/users/{id}", user.getId())
                        .header(HttpHeaders.AUTHORIZATION, adminBasic())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\": \"brand new secret\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, basic("forgetful", "brand new secret")))
                .andExpect(status().isOk());

        String own = login("forgetful", "brand new secret");
        MvcResult result = mockMvc.perform(patch("/users/{id}", user.getId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + own)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\": \"another new secret\"}"))
                .andExpect(status().isOk())
                .andReturn();
        List<String> cookies = result.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
        assertThat(cookies).hasSize(1);
        assertThat(cookies.get(0)).startsWith("tausession=").contains("Max-Age=0");
    }
}
