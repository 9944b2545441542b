package ai.theorem.extractor.extract;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Theorem body with its first {@code \label{...}} split off.
 */
record LabelledBody(Optional<String> label, String body) {

    private static final Pattern LABEL = Pattern.compile("\\\\label\\{(.*?)\\}");

    /**
     * Takes the first label key and removes every copy of that exact label command from the body.
     */
    static LabelledBody parse(String rawBody) {
        String body = rawBody == null ? "" : rawBody.strip();
        Matcher matcher = LABEL.matcher(body);
        if (!matcher.find()) {
            return new LabelledBody(Optional.empty(), body);
        }
        String command = matcher.group();
        return new LabelledBody(Optional.of(matcher.group(1)), body.replace(command, "").strip());
    }
}
