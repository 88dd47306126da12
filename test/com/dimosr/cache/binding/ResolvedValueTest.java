package com.dimosr.cache.binding;

import com.dimosr.cache.RequiredKeysCache;
import com.dimosr.cache.exceptions.InvalidTypeException;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResolvedValueTest {

    private RequiredKeysCache<String, Object> dependencies;

    @Before
    public void setup() {
        dependencies = new RequiredKeysCache<>(Collections.emptySet(), ImmutableMap.<String, Object>of("endpoint", "localhost:8080"));
    }

    @Test
    public void registersTheKeyAsRequired() {
        ResolvedValue<String, String> endpoint = new ResolvedValue<>(dependencies, "endpoint", String.class);

        assertThat(endpoint.get()).isEqualTo("localhost:8080");
        assertThat(dependencies.getRequiredKeys()).containsExactly("endpoint");

        dependencies.remove("endpoint");
        assertThat(endpoint.get()).isEqualTo("localhost:8080");
    }

    @Test
    public void failsWhenTheDependencyIsMissing() {
        assertThatThrownBy(() -> new ResolvedValue<>(dependencies, "database", String.class))
                .isInstanceOf(MissingKeysException.class);
        assertThat(dependencies.getRequiredKeys()).isEmpty();
    }

    @Test
    public void failsWhenTheDependencyIsOfAnotherType() {
        ResolvedValue<String, Integer> endpoint = new ResolvedValue<>(dependencies, "endpoint", Integer.class);

        assertThatThrownBy(endpoint::get)
                .isInstanceOf(InvalidTypeException.class);
    }

    @Test
    public void setReplacesTheDependency() {
        ResolvedValue<String, String> endpoint = new ResolvedValue<>(dependencies, "endpoint", String.class);

        endpoint.set("remotehost:443");

        assertThat(endpoint.get()).isEqualTo("remotehost:443");
        assertThat(endpoint.getKey()).isEqualTo("endpoint");
    }
}
