/* (C)2026 */
package com.ammann.conversion.health;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.conversion.properties.ApiProperties;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.response.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("Health endpoints")
class HealthEndpointsTest {

    @Test
    @DisplayName("readiness reports the conversion engine")
    void readinessIncludesEngine() {
        Response response = given().when().get(ApiProperties.Health.READY);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("status")).isEqualTo("UP");
        assertThat(response.jsonPath().getList("checks.name", String.class)).contains("conversion-engine");
    }

    @Test
    @DisplayName("liveness is UP")
    void livenessIsUp() {
        Response response = given().when().get(ApiProperties.Health.LIVE);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getList("checks.name", String.class)).contains("alive");
    }
}
