/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.generation;

import com.aegis.rulegov.api.GeneratedRule;
import com.aegis.rulegov.api.GenerationRequest;
import com.aegis.rulegov.api.RuleGenerator;
import com.aegis.rulegov.api.exceptions.GenerationFailureException;
import com.aegis.rulegov.api.exceptions.GenerationFailureException.Reason;
import com.aegis.rulegov.api.json.RuleJson;
import com.aegis.rulegov.api.model.GenerationMetadata;
import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.generation.RuleOutputSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chat-completion client that forces a single function call whose arguments are the rule.
 *
 * <p>No retries and no caching here; {@link com.aegis.rulegov.generation.GuardedRuleGenerator}
 * wraps this class with the timeout, cache and rate limit.
 */
public class OpenAiRuleGenerator implements RuleGenerator {

    private static final Logger logger = Logger.getLogger(OpenAiRuleGenerator.class.getName());

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final RuleOutputSchema schema;
    private final ObjectMapper mapper = RuleJson.mapper();
    private final ObjectMapper strictMapper = RuleJson.strictMapper();

    /**
     * @param endpoint base URL, {@code /chat/completions} is appended
     */
    public OpenAiRuleGenerator(OkHttpClient client, String endpoint, String apiKey, String model,
                               RuleOutputSchema schema) {
        this.client = client;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.schema = schema;
    }

    @Override
    public GeneratedRule generate(GenerationRequest request) {
        Request httpRequest = new Request.Builder()
                .url(endpoint + "/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(requestBody(request.instruction()), JSON))
                .build();

        long start = System.nanoTime();
        try (Response response = client.newCall(httpRequest).execute()) {
            long latencyMillis = (System.nanoTime() - start) / 1_000_000;
            if (response.code() == 429) {
                throw new GenerationFailureException(Reason.RATE_LIMITED, null,
                        "Generator rate limit reached upstream");
            }
            if (!response.isSuccessful()) {
                throw new GenerationFailureException(Reason.UPSTREAM_ERROR, null,
                        "Generator returned HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, null, "Generator returned no body");
            }
            return parse(body.string(), latencyMillis);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Generator call failed", e);
            throw new GenerationFailureException(Reason.UPSTREAM_ERROR, null,
                    "Generator unreachable: " + e.getMessage(), e);
        }
    }

    String requestBody(String instruction) {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", 0);

        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", schema.systemPrompt());
        messages.addObject().put("role", "user").put("content", instruction);

        root.putArray("tools").add(schema.toolDefinition());
        ObjectNode toolChoice = root.putObject("tool_choice");
        toolChoice.put("type", "function");
        toolChoice.putObject("function").put("name", RuleOutputSchema.FUNCTION_NAME);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode generation request", e);
        }
    }

    GeneratedRule parse(String body, long latencyMillis) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, null, "Generator response is not JSON", e);
        }
        JsonNode call = root.path("choices").path(0).path("message").path("tool_calls").path(0).path("function");
        if (!RuleOutputSchema.FUNCTION_NAME.equals(call.path("name").asText())) {
            throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, null,
                    "Generator did not call " + RuleOutputSchema.FUNCTION_NAME);
        }
        JsonNode arguments = call.path("arguments");
        if (!arguments.isTextual()) {
            throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, null, "Function call has no arguments");
        }

        Rule rule;
        try {
            rule = strictMapper.readValue(arguments.asText(), Rule.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, null,
                    "Function arguments do not describe a rule", e);
        }
        if (rule == null) {
            throw new GenerationFailureException(Reason.MALFORMED_OUTPUT, null, "Function arguments are empty");
        }

        String usedModel = root.path("model").asText(model);
        int tokens = root.path("usage").path("total_tokens").asInt(0);
        return new GeneratedRule(rule, new GenerationMetadata(usedModel, null, false, latencyMillis, tokens));
    }
}
