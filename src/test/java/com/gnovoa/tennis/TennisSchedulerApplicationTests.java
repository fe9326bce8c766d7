package com.gnovoa.tennis;

import static org.assertj.core.api.AssertionsForClassTypes.assertThat;

import com.jayway.jsonpath.JsonPath;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.resttestclient.autoconfigure.AutoConfigureRestTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.client.RestTestClient;

/** Basic integration tests */
@ActiveProfiles("integrationTest")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureRestTestClient
class TennisSchedulerApplicationTests {

  @Autowired private RestTestClient restTestClient;

  @Test
  @DisplayName("Should verify health endpoint returns UP")
  void healthEndpointReturnsUp() {
    restTestClient
        .get()
        .uri("/actuator/health")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("UP");
  }

  @Test
  @DisplayName("Should verify Swagger UI HTML page loads")
  void swaggerUiIsReachable() {
    restTestClient
        .get()
        .uri("/swagger-ui/index.html")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .contentTypeCompatibleWith("text/html")
        .expectBody(String.class)
        .consumeWith(
            result -> {
              String body = result.getResponseBody();
              assertThat(body).isNotNull();
              assertThat(body).containsIgnoringCase("swagger ui");
            });
  }

  @Test
  @DisplayName("Should verify OpenAPI JSON document is available")
  void openApiSpecShouldBeAvailable() {
    restTestClient
        .get()
        .uri("/v3/api-docs")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.openapi")
        .exists()
        .jsonPath("$.info.title")
        .isNotEmpty()
        .jsonPath("$.paths['/api/matches/bulk']")
        .exists()
        .jsonPath("$.paths['/api/matches/{matchId}/preview']")
        .exists();
  }

  @Test
  void apiDocsYamlOk() {

    restTestClient
        .get()
        .uri("/v3/api-docs.yaml")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .contentType("application/vnd.oai.openapi")
        .expectBody(String.class)
        .consumeWith(
            result -> {
              String yamlBody = result.getResponseBody();
              assertThat(yamlBody).isNotNull();
              // Check for key YAML markers
              assertThat(yamlBody).contains("openapi: 3.");
              assertThat(yamlBody).contains("paths:");
            });
  }

  @Test
  @DisplayName("Should generate, schedule and protect fixtures of the seeded league")
  void fixtureLifecycle() {
    String generated =
        restTestClient
            .post()
            .uri("/api/leagues/7/fixtures")
            .exchange()
            .expectStatus()
            .isOk()
            .expectBody(String.class)
            .returnResult()
            .getResponseBody();
    assertThat(JsonPath.<Integer>read(generated, "$.createdCount")).isEqualTo(6);

    restTestClient
        .post()
        .uri("/api/leagues/7/fixtures")
        .exchange()
        .expectBody()
        .jsonPath("$.createdCount")
        .isEqualTo(0);

    long matchId = JsonPath.<Number>read(generated, "$.created[0].id").longValue();
    long secondId = JsonPath.<Number>read(generated, "$.created[1].id").longValue();

    restTestClient
        .post()
        .uri("/api/matches/" + matchId + "/preview")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("date", "2025-04-05"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.schedulable")
        .isEqualTo(true)
        .jsonPath("$.facilityId")
        .isEqualTo(10)
        .jsonPath("$.proposedTimes[0]")
        .isEqualTo("10:30");

    restTestClient
        .post()
        .uri("/api/matches/" + matchId + "/schedule")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("facilityId", 10, "date", "2025-04-05", "timeOption", "AUTO"))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("FULLY_SCHEDULED")
        .jsonPath("$.scheduledTimes.length()")
        .isEqualTo(3)
        .jsonPath("$.scheduledTimes[2]")
        .isEqualTo("10:30");

    restTestClient
        .post()
        .uri("/api/matches/" + secondId + "/schedule")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("facilityId", 10, "date", "2025-04-05", "timeOption", "SAME", "time", "10:30"))
        .exchange()
        .expectStatus()
        .isEqualTo(HttpStatus.CONFLICT)
        .expectBody()
        .jsonPath("$.kind")
        .isEqualTo("CONFLICT");

    restTestClient
        .get()
        .uri("/api/matches/" + secondId + "/options?limit=3")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.length()")
        .isEqualTo(3)
        .jsonPath("$[0].facilityId")
        .isEqualTo(10);

    restTestClient
        .delete()
        .uri("/api/matches/" + matchId)
        .exchange()
        .expectStatus()
        .isEqualTo(HttpStatus.CONFLICT)
        .expectBody()
        .jsonPath("$.kind")
        .isEqualTo("DELETE_UNSAFE");

    restTestClient
        .post()
        .uri("/api/matches/" + matchId + "/schedule")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("facilityId", 10, "date", "2025-04-12"))
        .exchange()
        .expectStatus()
        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
        .expectBody()
        .jsonPath("$.kind")
        .isEqualTo("CAPACITY");

    restTestClient
        .get()
        .uri("/api/leagues/7/summary")
        .exchange()
        .expectBody()
        .jsonPath("$.totalMatches")
        .isEqualTo(6)
        .jsonPath("$.fullyScheduledMatches")
        .isEqualTo(1);

    restTestClient
        .post()
        .uri("/api/matches/" + matchId + "/unschedule")
        .exchange()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("UNSCHEDULED");

    restTestClient
        .post()
        .uri("/api/matches/bulk")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("operation", "AUTO_SCHEDULE", "scope", "LEAGUE", "leagueId", 7, "dryRun", true))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.dryRun")
        .isEqualTo(true)
        .jsonPath("$.succeededCount")
        .isEqualTo(6);

    restTestClient
        .get()
        .uri("/api/leagues/7/summary")
        .exchange()
        .expectBody()
        .jsonPath("$.fullyScheduledMatches")
        .isEqualTo(0);

    restTestClient
        .post()
        .uri("/api/matches/bulk")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("operation", "AUTO_SCHEDULE", "scope", "LEAGUE", "leagueId", 7))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.succeededCount")
        .isEqualTo(6)
        .jsonPath("$.details.length()")
        .isEqualTo(6);
  }

  @Test
  void unknownLeagueIsNotFound() {
    restTestClient.get().uri("/api/leagues/999/matches").exchange().expectStatus().isNotFound();
  }
}
