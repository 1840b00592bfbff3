package me.golemcore.persona.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Factory for Feign HTTP clients with OkHttp transport and Jackson JSON
 * encoding.
 *
 * <p>
 * All clients share the OkHttp connection pool and the application
 * {@link ObjectMapper}. Feign's own retryer is switched off; callers own their
 * retry behavior.
 *
 * <pre>{@code
 * MyApi client = factory.create(MyApi.class, "https://api.example.com", Duration.ofSeconds(30));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client whose every call, from connect to the last body
     * byte, must finish within {@code callTimeout}.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Duration callTimeout) {
        okhttp3.OkHttpClient bounded = okHttpClient.newBuilder()
                .callTimeout(callTimeout)
                .build();
        Request.Options options = new Request.Options(
                okHttpClient.connectTimeoutMillis(), TimeUnit.MILLISECONDS,
                callTimeout.toMillis(), TimeUnit.MILLISECONDS,
                true);
        return Feign.builder()
                .client(new OkHttpClient(bounded))
                .options(options)
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }
}
