package fr.lapetina.inferencebench.domain.model;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A backend host serving models.
 * Immutable; built once from configuration and shared by all workers.
 */
public final class Host {

    public static final String TYPE_OLLAMA = "ollama";
    public static final String TYPE_LLAMA_CPP = "llama.cpp";

    private final String name;
    private final URI baseUrl;
    private final String type;
    private final String declaredType;
    private final List<String> models;
    private final String systemPrompt;
    private final Map<String, Object> parameters;
    private final Map<String, String> metadata;

    private Host(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Host name is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        this.type = normalizeType(builder.type);
        this.declaredType = builder.type == null ? "" : builder.type.trim();
        this.models = List.copyOf(builder.models);
        this.systemPrompt = builder.systemPrompt;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Normalizes a declared backend type.
     * Blank maps to {@value #TYPE_OLLAMA}, {@code llamacpp} maps to {@value #TYPE_LLAMA_CPP},
     * anything else is returned lower-cased and trimmed.
     */
    public static String normalizeType(String type) {
        String normalized = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", TYPE_OLLAMA -> TYPE_OLLAMA;
            case TYPE_LLAMA_CPP, "llamacpp" -> TYPE_LLAMA_CPP;
            default -> normalized;
        };
    }

    public String getName() {
        return name;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * Returns the normalized backend type.
     */
    public String getType() {
        return type;
    }

    /**
     * Returns the type as configured, trimmed, or an empty string when none was given.
     */
    public String getDeclaredType() {
        return declaredType;
    }

    public List<String> getModels() {
        return models;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Resolves an endpoint path against the base URL.
     */
    public URI resolve(String path) {
        String base = baseUrl.toString();
        if (!base.endsWith("/")) {
            base += "/";
        }
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return URI.create(base + relative);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Host host = (Host) o;
        return name.equals(host.name) && baseUrl.equals(host.baseUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, baseUrl);
    }

    @Override
    public String toString() {
        return "Host{" +
                "name='" + name + '\'' +
                ", baseUrl=" + baseUrl +
                ", type='" + type + '\'' +
                ", models=" + models +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private URI baseUrl;
        private String type;
        private final List<String> models = new ArrayList<>();
        private String systemPrompt;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = URI.create(baseUrl);
            return this;
        }

        public Builder baseUrl(URI baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder models(List<String> models) {
            this.models.clear();
            if (models != null) {
                this.models.addAll(models);
            }
            return this;
        }

        public Builder addModel(String model) {
            this.models.add(model);
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Host build() {
            return new Host(this);
        }
    }
}
