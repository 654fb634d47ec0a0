package io.devicerelay.safety;

import io.devicerelay.model.CommandPayload;
import io.devicerelay.model.CommandType;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns operator text into a typed payload using an ordered rule table. The first matching
 * rule wins; text no rule claims becomes a shell command. English and Korean keywords are
 * recognized.
 */
public final class CommandParser {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private record Rule(CommandType type, Pattern pattern, Function<Matcher, String> extractor) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(CommandType.FILE_READ,
                    Pattern.compile("^(?:파일\\s*읽기|파일\\s*열기|read|cat)\\s+(.+)$", FLAGS),
                    m -> m.group(1).trim()),
            new Rule(CommandType.FILE_LIST,
                    Pattern.compile("^(?:파일\\s*목록|파일\\s*리스트|ls|dir|list)(?:\\s+(.*))?$", FLAGS),
                    m -> m.group(1) == null || m.group(1).isBlank() ? "." : m.group(1).trim()),
            new Rule(CommandType.BROWSER_OPEN,
                    Pattern.compile("^(?:브라우저|열기|open|browse)\\s+(https?://\\S+)\\s*$", FLAGS),
                    m -> m.group(1)),
            new Rule(CommandType.CLIPBOARD,
                    Pattern.compile("^(?:클립보드|clipboard)(?:\\s+.*)?$", FLAGS),
                    m -> "get"),
            new Rule(CommandType.SCREENSHOT,
                    Pattern.compile("^(?:스크린샷|screenshot|캡처)(?:\\s+.*)?$", FLAGS),
                    m -> "capture")
    );

    public CommandPayload parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Command text must not be blank");
        }
        String trimmed = text.trim();
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(trimmed);
            if (m.matches()) {
                return CommandPayload.of(rule.type(), rule.extractor().apply(m));
            }
        }
        return CommandPayload.shell(trimmed);
    }
}
