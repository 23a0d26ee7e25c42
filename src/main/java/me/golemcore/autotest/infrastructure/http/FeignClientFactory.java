package me.golemcore.autotest.infrastructure.http;

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

import java.util.concurrent.TimeUnit;

/**
 * Builds the Feign clients used for side-channel calls to the completion
 * service, such as the health probe.
 *
 * <p>
 * Clients share the OkHttp connection pool and the application
 * {@link ObjectMapper}. They never retry: a probe must report the first
 * failure instead of stalling the health endpoint.
 *
 * <pre>{@code
 * CompletionServiceApi api = factory.create(CompletionServiceApi.class, "http://ollama:11434", 5000);
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
     * Create a client whose connect and read timeouts are both
     * {@code timeoutMs}.
     */
    public <T> T create(Class<T> apiType, String baseUrl, long timeoutMs) {
        Request.Options options = new Request.Options(timeoutMs, TimeUnit.MILLISECONDS,
                timeoutMs, TimeUnit.MILLISECONDS, true);
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .options(options)
                .retryer(Retryer.NEVER_RETRY)
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .target(apiType, baseUrl);
    }
}
