package jellyvr.adapter.in.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.UUID;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import jellyvr.mock.JellyfinWireMockResource;

@QuarkusTest
@QuarkusTestResource(JellyfinWireMockResource.class)
@DisplayName("RootResource")
class RootResourceTest {

    private static final String LOGIN_COOKIE = "jellyvr_login";
    private static final String SESSION_COOKIE = "jellyvr_session";

    @BeforeEach
    void setUp() {
        JellyfinWireMockResource.server().resetAll();
        JellyfinWireMockResource.server()
                .stubFor(post(urlEqualTo("/Sessions/Capabilities/Full")).willReturn(aResponse().withStatus(204)));
        JellyfinWireMockResource.server()
                .stubFor(post(urlEqualTo("/Sessions/Logout")).willReturn(aResponse().withStatus(204)));
    }

    private static String initiates(String code) {
        final var secret = "secret-" + UUID.randomUUID();
        JellyfinWireMockResource.server()
                .stubFor(post(urlEqualTo("/QuickConnect/Initiate"))
                        .willReturn(okJson("{\"Secret\":\"" + secret + "\",\"Code\":\"" + code + "\"}")));
        return secret;
    }

    private static void polls(String secret, boolean authenticated) {
        JellyfinWireMockResource.server()
                .stubFor(get(urlPathEqualTo("/QuickConnect/Connect"))
                        .withQueryParam("Secret", equalTo(secret))
                        .willReturn(okJson("{\"Authenticated\":" + authenticated + "}")));
    }

    private static void approves(String secret, String userId, String username) {
        polls(secret, true);
        JellyfinWireMockResource.server()
                .stubFor(post(urlEqualTo("/Users/AuthenticateWithQuickConnect"))
                        .willReturn(okJson("{\"User\":{\"Id\":\"" + userId + "\",\"Name\":\"" + username
                                + "\"},\"AccessToken\":\"tok-" + userId + "\"}")));
    }

    @Nested
    @DisplayName("GET /")
    class LoginPageTests {

        @Test
        @DisplayName("should start a QuickConnect login for a new browser")
        void shouldStartLogin() {
            final var secret = initiates("ABC123");

            given().when()
                    .get("/")
                    .then()
                    .statusCode(200)
                    .contentType(containsString("text/html"))
                    .body(containsString("Code: ABC123"))
                    .cookie(LOGIN_COOKIE, secret);
        }

        @Test
        @DisplayName("should keep showing the code while the request is pending")
        void shouldShowPendingCode() {
            final var secret = initiates("PEND01");
            given().get("/").then().statusCode(200);
            polls(secret, false);

            given().cookie(LOGIN_COOKIE, secret)
                    .when()
                    .get("/")
                    .then()
                    .statusCode(200)
                    .body(containsString("Code: PEND01"));
        }

        @Test
        @DisplayName("should reveal the credentials once and then show the session")
        void shouldRevealCredentialsOnce() {
            final var secret = initiates("APPR01");
            given().get("/").then().statusCode(200);
            approves(secret, "u-root-1", "root-alice");

            final var sessionId = given().cookie(LOGIN_COOKIE, secret)
                    .when()
                    .get("/")
                    .then()
                    .statusCode(200)
                    .body(containsString("User: root-alice"))
                    .body(containsString("Pass: "))
                    .extract()
                    .cookie(SESSION_COOKIE);
            assertNotNull(sessionId);

            given().cookie(SESSION_COOKIE, sessionId)
                    .when()
                    .get("/")
                    .then()
                    .statusCode(200)
                    .body(containsString("User: root-alice"))
                    .body(not(containsString("Pass: ")));
        }

        @Test
        @DisplayName("should show a generic unavailable page when Jellyfin is down")
        void shouldShowUnavailablePage() {
            JellyfinWireMockResource.server()
                    .stubFor(post(urlEqualTo("/QuickConnect/Initiate")).willReturn(aResponse().withStatus(503)));

            given().when()
                    .get("/")
                    .then()
                    .statusCode(503)
                    .body(containsString("Jellyfin is unavailable"))
                    .body(not(containsString("503")));
        }
    }

    @Nested
    @DisplayName("GET /login/status")
    class StatusTests {

        @Test
        @DisplayName("should report unknown without a login cookie")
        void shouldReportUnknown() {
            given().when().get("/login/status").then().statusCode(200).body("state", is("UNKNOWN"));
        }

        @Test
        @DisplayName("should report a pending login with its code")
        void shouldReportPending() {
            final var secret = initiates("STAT01");
            given().get("/").then().statusCode(200);
            polls(secret, false);

            given().cookie(LOGIN_COOKIE, secret)
                    .when()
                    .get("/login/status")
                    .then()
                    .statusCode(200)
                    .body("state", is("PENDING"))
                    .body("displayCode", is("STAT01"));
        }

        @Test
        @DisplayName("should answer 410 once Jellyfin dropped the code")
        void shouldReportExpired() {
            final var secret = initiates("GONE01");
            given().get("/").then().statusCode(200);
            JellyfinWireMockResource.server()
                    .stubFor(get(urlPathEqualTo("/QuickConnect/Connect"))
                            .withQueryParam("Secret", equalTo(secret))
                            .willReturn(aResponse().withStatus(404)));

            given().cookie(LOGIN_COOKIE, secret)
                    .when()
                    .get("/login/status")
                    .then()
                    .statusCode(410)
                    .contentType("application/problem+json")
                    .body("detail", containsString("GONE01"));
        }
    }
}
