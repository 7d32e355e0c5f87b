package me.golemcore.map.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application configuration bound from {@code map.*} properties.
 *
 * <p>
 * Sections:
 * <ul>
 * <li>{@code llm} - provider selection, model and sampling settings</li>
 * <li>{@code http} - shared OkHttp client timeouts and pool</li>
 * <li>{@code tool-loop} - iteration cap and repeated-call guard</li>
 * <li>{@code view} - initial map view of a new connection</li>
 * <li>{@code geocoding} - ArcGIS endpoint and result zoom</li>
 * <li>{@code gazetteer} - location of the place-name table</li>
 * <li>{@code web} - WebSocket endpoint</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "map")
@Data
public class MapAgentProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ViewProperties view = new ViewProperties();
    private GeocodingProperties geocoding = new GeocodingProperties();
    private GazetteerProperties gazetteer = new GazetteerProperties();
    private WebProperties web = new WebProperties();

    @Data
    public static class LlmProperties {
        private String provider = "custom"; // custom, langchain4j, none
        private String model = "gpt-4o-mini";
        private double temperature = 0.7;
        private int maxTokens = 1000;
        private CustomProperties custom = new CustomProperties();
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class CustomProperties {
        private String apiUrl;
        private String apiKey;
    }

    @Data
    public static class Langchain4jProperties {
        private String apiKey;
        private String baseUrl;
        private long timeoutMs = 60000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxIterations = 5;
        private boolean stopOnRepeatedToolCall = false;
    }

    @Data
    public static class ViewProperties {
        private double defaultLongitude = 0.0;
        private double defaultLatitude = 0.0;
        private int defaultZoom = 2;
    }

    @Data
    public static class GeocodingProperties {
        private String baseUrl = "https://geocode.arcgis.com/arcgis/rest/services/World/GeocodeServer";
        private int maxLocations = 10;
        private int resultZoom = 15;
    }

    @Data
    public static class GazetteerProperties {
        private String location = "classpath:gazetteer.json";
    }

    @Data
    public static class WebProperties {
        private String path = "/ws";
    }
}
