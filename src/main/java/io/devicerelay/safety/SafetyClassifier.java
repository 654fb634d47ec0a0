package io.devicerelay.safety;

import io.devicerelay.model.CommandPayload;
import io.devicerelay.model.CommandType;
import io.devicerelay.model.RiskLevel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Grades a parsed command before it is queued.
 *
 * <p>Shell commands are always {@link RiskLevel#HIGH}: destructive ones are blocked outright,
 * the rest need operator confirmation. File access inside a workspace root runs without
 * confirmation unless it touches a credential store. Browser, clipboard and screenshot
 * commands run without confirmation.
 */
public final class SafetyClassifier {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private record Hint(String label, Pattern pattern) {
    }

    private static final List<Hint> DESTRUCTIVE = List.of(
            new Hint("recursive delete of a root or home directory", Pattern.compile(
                    "\\brm\\s+(?:-[\\w-]+\\s+)*-(?:[a-z]*r[a-z]*|-recursive)\\s+(?:-[\\w-]+\\s+)*(?:/\\*?|~/?\\*?|\\*)(?=[\\s;&|]|$)",
                    FLAGS)),
            new Hint("filesystem format", Pattern.compile("\\bmkfs(?:\\.\\w+)?\\b", FLAGS)),
            new Hint("raw write to a block device", Pattern.compile("\\bdd\\b.*\\bof=/dev/", FLAGS)),
            new Hint("redirect onto a raw disk", Pattern.compile(
                    ">\\s*/dev/(?:sd[a-z]|hd[a-z]|nvme\\d|mmcblk\\d|disk\\d)", FLAGS)),
            new Hint("fork bomb", Pattern.compile(":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:")),
            new Hint("world-writable root filesystem", Pattern.compile(
                    "\\bchmod\\s+-[a-z]*r[a-z]*\\s+0?777\\s+/(?=[\\s;&|]|$)", FLAGS)),
            new Hint("remote script piped to a shell", Pattern.compile(
                    "\\b(?:curl|wget)\\b[^|]*\\|\\s*(?:sudo\\s+)?(?:ba|z|da)?sh\\b", FLAGS)),
            new Hint("system shutdown or reboot", Pattern.compile(
                    "\\b(?:shutdown|reboot|halt|poweroff)\\b", FLAGS)),
            new Hint("drive format", Pattern.compile("\\bformat\\s+[a-z]:", FLAGS)),
            new Hint("credential exfiltration", Pattern.compile(
                    "(?:\\.ssh\\b|id_rsa|id_ed25519|\\.aws/credentials|/etc/shadow|\\.gnupg).*\\b(?:curl|wget|nc|ncat|netcat|scp|rsync|ftp)\\b",
                    FLAGS)),
            new Hint("credential exfiltration", Pattern.compile(
                    "\\b(?:curl|wget|nc|ncat|netcat|scp|rsync|ftp)\\b.*(?:\\.ssh\\b|id_rsa|id_ed25519|\\.aws/credentials|/etc/shadow|\\.gnupg)",
                    FLAGS))
    );

    private static final List<Hint> SHELL_RISKS = List.of(
            new Hint("runs with elevated privileges (sudo)", Pattern.compile("\\bsudo\\b", FLAGS)),
            new Hint("installs or removes packages", Pattern.compile(
                    "\\b(?:apt(?:-get)?|yum|dnf|brew|pip3?|npm|pnpm|yarn|choco|winget)\\s+(?:install|remove|uninstall|purge|add)\\b",
                    FLAGS)),
            new Hint("rewrites git history or remote state", Pattern.compile(
                    "\\bgit\\s+(?:push|reset\\s+--hard|clean|rebase|checkout\\s+--)", FLAGS)),
            new Hint("deletes files", Pattern.compile("\\b(?:rm|rmdir|del|erase)\\b", FLAGS)),
            new Hint("terminates processes", Pattern.compile("\\b(?:kill|pkill|killall|taskkill)\\b", FLAGS)),
            new Hint("changes permissions or ownership", Pattern.compile("\\b(?:chmod|chown|chgrp)\\b", FLAGS)),
            new Hint("controls system services", Pattern.compile("\\b(?:systemctl|service|launchctl)\\b", FLAGS)),
            new Hint("overwrites a file through redirection", Pattern.compile("(?<![>&\\d])>(?!>)\\s*\\S", FLAGS)),
            new Hint("makes network requests", Pattern.compile("\\b(?:curl|wget|ssh|scp|rsync)\\b", FLAGS))
    );

    private static final List<String> SENSITIVE_PATH_MARKERS = List.of(
            ".ssh", ".gnupg", ".aws", ".env", ".netrc", "id_rsa", "id_ed25519", ".pem", ".key",
            "keychain", "/etc/shadow", "/etc/sudoers"
    );

    // Clients may hand file paths to a shell; any of these would chain or substitute a second command.
    private static final Pattern SHELL_METACHARACTERS = Pattern.compile("[;|&`]|\\$\\(");

    private static final String GENERIC_SHELL_WARNING = "shell command runs with the device user's permissions";

    private final List<PathAnchor> workspaceRoots;

    public SafetyClassifier(List<String> workspaceRoots) {
        List<PathAnchor> roots = new ArrayList<>();
        for (String root : workspaceRoots == null ? List.<String>of() : workspaceRoots) {
            PathAnchor anchor = PathAnchor.parse(root);
            if (anchor != null && !anchor.escapes()) {
                roots.add(anchor);
            }
        }
        this.workspaceRoots = List.copyOf(roots);
    }

    public SafetyVerdict classify(CommandPayload payload) {
        if (payload == null || payload.type() == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        return switch (payload.type()) {
            case SHELL -> classifyShell(payload.command());
            case FILE_READ, FILE_LIST -> classifyPath(payload.type(), payload.command());
            case BROWSER_OPEN, CLIPBOARD, SCREENSHOT -> SafetyVerdict.autoRun(RiskLevel.LOW);
        };
    }

    private SafetyVerdict classifyShell(String command) {
        String text = command == null ? "" : command;
        for (Hint hint : DESTRUCTIVE) {
            if (hint.pattern().matcher(text).find()) {
                return SafetyVerdict.block(hint.label());
            }
        }
        List<String> warnings = new ArrayList<>();
        for (Hint hint : SHELL_RISKS) {
            if (hint.pattern().matcher(text).find()) {
                warnings.add(hint.label());
            }
        }
        if (warnings.isEmpty()) {
            warnings.add(GENERIC_SHELL_WARNING);
        }
        return SafetyVerdict.confirm(RiskLevel.HIGH, warnings, "Shell commands need confirmation");
    }

    private SafetyVerdict classifyPath(CommandType type, String rawPath) {
        String path = rawPath == null || rawPath.isBlank() ? "." : rawPath.trim();
        String verb = type == CommandType.FILE_READ ? "reads" : "lists";
        if (touchesCredentialStore(path)) {
            return SafetyVerdict.confirm(RiskLevel.MEDIUM,
                    List.of(verb + " a credential or key location: " + path),
                    "Sensitive path needs confirmation");
        }
        if (SHELL_METACHARACTERS.matcher(path).find()) {
            return SafetyVerdict.confirm(RiskLevel.MEDIUM,
                    List.of(verb + " a path containing shell control characters: " + path),
                    "Path with shell control characters needs confirmation");
        }
        PathAnchor target = PathAnchor.parse(path);
        if (target == null || target.escapes()) {
            return SafetyVerdict.confirm(RiskLevel.MEDIUM,
                    List.of(verb + " a path that leaves the workspace: " + path),
                    "Path outside the workspace needs confirmation");
        }
        for (PathAnchor root : workspaceRoots) {
            if (root.contains(target)) {
                return SafetyVerdict.autoRun(RiskLevel.LOW);
            }
        }
        return SafetyVerdict.confirm(RiskLevel.MEDIUM,
                List.of(verb + " a path outside the workspace: " + path),
                "Path outside the workspace needs confirmation");
    }

    private static boolean touchesCredentialStore(String path) {
        String normalized = path.replace('\\', '/').toLowerCase(Locale.ROOT);
        for (String marker : SENSITIVE_PATH_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A path split into its anchor ({@code ~}, {@code .}, {@code /} or a drive letter) and
     * normalized segments. {@code escapes} is set when {@code ..} climbs above the anchor.
     */
    record PathAnchor(String anchor, List<String> segments, boolean escapes) {
        static PathAnchor parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String p = raw.trim().replace('\\', '/');
            if (p.length() >= 2 && (p.startsWith("\"") && p.endsWith("\"") || p.startsWith("'") && p.endsWith("'"))) {
                p = p.substring(1, p.length() - 1);
            }
            String anchor;
            String rest;
            if (p.equals("~") || p.startsWith("~/")) {
                anchor = "~";
                rest = p.substring(1);
            } else if (p.startsWith("/")) {
                anchor = "/";
                rest = p;
            } else if (p.length() >= 2 && Character.isLetter(p.charAt(0)) && p.charAt(1) == ':') {
                anchor = p.substring(0, 2).toUpperCase(Locale.ROOT);
                rest = p.substring(2);
            } else if (p.startsWith("~")) {
                // ~otheruser is someone else's home
                anchor = "/";
                rest = "/home/" + p.substring(1);
            } else {
                anchor = ".";
                rest = p;
            }
            Deque<String> stack = new ArrayDeque<>();
            boolean escapes = false;
            for (String segment : rest.split("/")) {
                if (segment.isEmpty() || segment.equals(".")) {
                    continue;
                }
                if (segment.equals("..")) {
                    if (stack.isEmpty()) {
                        escapes = true;
                    } else {
                        stack.removeLast();
                    }
                    continue;
                }
                stack.addLast(segment);
            }
            return new PathAnchor(anchor, List.copyOf(stack), escapes);
        }

        boolean contains(PathAnchor other) {
            if (!anchor.equals(other.anchor) || other.segments.size() < segments.size()) {
                return false;
            }
            return other.segments.subList(0, segments.size()).equals(segments);
        }
    }
}
