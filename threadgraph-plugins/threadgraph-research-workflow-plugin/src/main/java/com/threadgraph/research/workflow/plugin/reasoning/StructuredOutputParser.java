package com.threadgraph.research.workflow.plugin.reasoning;

import com.threadgraph.integration.exception.ThreadGraphStageRuntimeException;
import com.threadgraph.research.workflow.plugin.exception.ResearchWorkflowErrorCodes;
import com.threadgraph.research.workflow.plugin.misc.ResearchWorkflowObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the JSON answer of a structured reasoning call into a validated model object.
 * Answers wrapped in Markdown code fences are unwrapped first.
 */
@Slf4j
public class StructuredOutputParser {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final ValidatorFactory validatorFactory;

    public StructuredOutputParser() {
        this(ResearchWorkflowObjectMapper.getInstance());
    }

    public StructuredOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    public <T> T parse(String text, Class<T> type) {
        String typeName = type.getSimpleName();
        if (text == null || text.isBlank()) {
            throw new ThreadGraphStageRuntimeException(
                    ResearchWorkflowErrorCodes.REASONING_MALFORMED_RESPONSE,
                    Map.of("type", typeName, "reason", "empty answer"));
        }

        T value;
        try {
            value = objectMapper.readValue(stripCodeFence(text), type);
        } catch (JacksonException e) {
            log.debug("Unparseable {} answer: {}", typeName, text);
            throw new ThreadGraphStageRuntimeException(
                    ResearchWorkflowErrorCodes.REASONING_MALFORMED_RESPONSE,
                    Map.of("type", typeName, "reason", String.valueOf(e.getOriginalMessage())), e);
        }
        if (value == null) {
            throw new ThreadGraphStageRuntimeException(
                    ResearchWorkflowErrorCodes.REASONING_MALFORMED_RESPONSE,
                    Map.of("type", typeName, "reason", "null document"));
        }

        Set<ConstraintViolation<T>> violations = validatorFactory.getValidator().validate(value);
        if (!violations.isEmpty()) {
            String summary = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ThreadGraphStageRuntimeException(
                    ResearchWorkflowErrorCodes.REASONING_CONSTRAINT_VIOLATION,
                    Map.of("type", typeName, "violations", summary), null, violations);
        }
        return value;
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        return matcher.matches() ? matcher.group(1) : trimmed;
    }
}
