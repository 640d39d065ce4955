package com.wf.stress.config;

import com.mongodb.WriteConcern;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionConfigTest {

    @Test
    void shouldBuildConnectionStringFromSeedList() {
        ConnectionConfig config = new ConnectionConfig();
        Endpoint endpoint = new Endpoint(List.of("a", "b"), 27018);

        assertThat(config.toConnectionString(endpoint)).isEqualTo("mongodb://a:27018,b:27018/");
    }

    @Test
    void shouldResolveWriteConcernCaseInsensitively() {
        ConnectionConfig config = new ConnectionConfig();

        config.setWriteConcern("MAJORITY");
        assertThat(config.resolveWriteConcern()).isEqualTo(WriteConcern.MAJORITY);

        config.setWriteConcern("unacknowledged");
        assertThat(config.resolveWriteConcern()).isEqualTo(WriteConcern.UNACKNOWLEDGED);
    }

    @Test
    void shouldOnlyReportCredentialsWhenUsernameSet() {
        ConnectionConfig config = new ConnectionConfig();
        assertThat(config.hasCredentials()).isFalse();

        config.setUsername("admin");
        assertThat(config.hasCredentials()).isTrue();
    }
}
