package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.service.classifier.IntentClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds producer/consumer pipelines in an utterance such as
 * "find my resume and send it to Jay".
 *
 * <p>Detection is conservative. Only explicit sequencing markers split an utterance, longer
 * markers first ("and then", "after that", "then", "and"). Both segments must be classified
 * confidently by the pattern tier alone, and a {@link PipelineRule} must exist for the pair.
 * Anything else is left to single dispatch.
 */
@Component
public class PipelineDetector {

    private static final Logger LOG = LogManager.getLogger(PipelineDetector.class);

    private static final List<Pattern> MARKERS = List.of("and then", "after that", "then", "and").stream()
            .map(m -> Pattern.compile("(?:,\\s*)?\\b" + m.replace(" ", "\\s+") + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private final IntentClassifier classifier;
    private final List<PipelineRule> rules;

    @Autowired
    public PipelineDetector(IntentClassifier classifier) {
        this(classifier, PipelineRule.DEFAULT_RULES);
    }

    public PipelineDetector(IntentClassifier classifier, List<PipelineRule> rules) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.rules = List.copyOf(rules);
    }

    /**
     * @param text full utterance
     * @return the first pipeline found, or empty for single-step commands
     */
    public Optional<PipelinePlan> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern marker : MARKERS) {
            Matcher m = marker.matcher(text);
            while (m.find()) {
                String left = trimSegment(text.substring(0, m.start()));
                String right = trimSegment(text.substring(m.end()));
                if (left.isEmpty() || right.isEmpty()) {
                    continue;
                }
                Optional<Classification> producer = classifier.classifyDeterministic(left);
                if (producer.isEmpty()) {
                    continue;
                }
                Optional<Classification> consumer = classifier.classifyDeterministic(right);
                if (consumer.isEmpty()) {
                    continue;
                }
                Optional<PipelineRule> rule = PipelineRule.find(rules,
                        producer.get().intent(), consumer.get().intent());
                if (rule.isPresent()) {
                    LOG.debug("Pipeline detected: {} -> {}", rule.get().producer(), rule.get().consumer());
                    return Optional.of(new PipelinePlan(
                            producer.get().toCommand(left), consumer.get().toCommand(right), rule.get()));
                }
            }
        }
        return Optional.empty();
    }

    public List<PipelineRule> rules() {
        return rules;
    }

    private static String trimSegment(String s) {
        return s.replaceAll("^[\\s,;.]+|[\\s,;.]+$", "");
    }
}
