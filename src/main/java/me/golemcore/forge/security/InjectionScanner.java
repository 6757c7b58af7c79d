package me.golemcore.forge.security;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.forge.domain.model.PromptDocument;
import me.golemcore.forge.domain.model.ScanFinding;
import me.golemcore.forge.domain.model.ScanResult;
import me.golemcore.forge.domain.model.Severity;
import me.golemcore.forge.domain.model.TextLeaf;
import me.golemcore.forge.infrastructure.config.ForgeProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-commit security gate that looks for prompt injection in content.
 *
 * <p>
 * Every text leaf of a document is checked against:
 * <ul>
 * <li>Instruction override - "ignore previous instructions", "new
 * instructions:"</li>
 * <li>Role manipulation - "you are now", "pretend you are"</li>
 * <li>Data exfiltration - "repeat your system prompt"</li>
 * <li>Encoding tricks - zero-width characters, base64 blobs hiding
 * keywords</li>
 * <li>Delimiter attacks - override phrases inside code fences or tags</li>
 * </ul>
 *
 * <p>
 * Sections named {@code persona} or {@code identity} only report critical
 * findings, since role-setting language is expected there. The scanner never
 * modifies content. Stateless and thread-safe.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InjectionScanner {

    private static final Set<String> LENIENT_SECTIONS = Set.of("persona", "identity");

    private static final List<PatternRule> INSTRUCTION_OVERRIDE_PATTERNS = List.of(
            new PatternRule("ignore_previous", "ignore\\s+(all\\s+)?previous\\s+instructions", Severity.CRITICAL,
                    "Attempts to override previous instructions"),
            new PatternRule("disregard_above", "disregard\\s+(everything\\s+)?(above|previous)", Severity.CRITICAL,
                    "Attempts to disregard prior context"),
            new PatternRule("forget_everything", "forget\\s+everything", Severity.CRITICAL,
                    "Attempts to clear instruction memory"),
            new PatternRule("new_instructions", "new\\s+instructions\\s*:", Severity.CRITICAL,
                    "Injects new instructions"),
            new PatternRule("system_prompt_override", "system\\s+prompt\\s+override", Severity.CRITICAL,
                    "Attempts to override system prompt"));

    private static final List<PatternRule> ROLE_MANIPULATION_PATTERNS = List.of(
            new PatternRule("you_are_now", "you\\s+are\\s+now\\b", Severity.HIGH,
                    "Attempts to redefine the assistant's role"),
            new PatternRule("pretend_you_are", "pretend\\s+(that\\s+)?you\\s+are", Severity.HIGH,
                    "Attempts role manipulation via pretending"),
            new PatternRule("act_as_if_instructions", "act\\s+as\\s+if\\s+your\\s+instructions", Severity.HIGH,
                    "Attempts to manipulate instruction interpretation"));

    private static final List<PatternRule> DATA_EXFILTRATION_PATTERNS = List.of(
            new PatternRule("repeat_system_prompt", "repeat\\s+your\\s+system\\s+prompt", Severity.CRITICAL,
                    "Attempts to extract system prompt"),
            new PatternRule("output_instructions", "output\\s+your\\s+instructions", Severity.CRITICAL,
                    "Attempts to extract instructions"),
            new PatternRule("what_were_you_told", "what\\s+were\\s+you\\s+told", Severity.HIGH,
                    "Attempts to extract instructions"));

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200b\\u200c\\u200d\\u2060\\ufeff]");
    private static final Pattern BASE64_TOKEN = Pattern.compile("[A-Za-z0-9+/]{20,}={0,2}");
    private static final List<String> BASE64_KEYWORDS = List.of("ignore", "instructions", "system prompt",
            "you are now");

    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern TAG_CONTENT = Pattern.compile("<[^>]+>([^<]+)</[^>]+>");
    private static final List<String> DELIMITER_KEYWORDS = List.of("ignore previous", "new instructions",
            "system prompt");

    private final ForgeProperties properties;

    /**
     * Scan every text leaf of a content document.
     */
    public ScanResult scan(Map<String, Object> content) {
        if (!properties.getSecurity().isInjectionScanEnabled()) {
            return ScanResult.cleanResult();
        }

        List<ScanFinding> findings = new ArrayList<>();
        for (TextLeaf leaf : PromptDocument.of(content).textLeaves()) {
            List<ScanFinding> leafFindings = scanText(leaf.text(), leaf.location());
            if (leaf.sectionId() != null && LENIENT_SECTIONS.contains(leaf.sectionId())) {
                leafFindings.removeIf(finding -> finding.getSeverity() != Severity.CRITICAL);
            }
            findings.addAll(leafFindings);
        }

        Severity riskLevel = Severity.LOW;
        for (ScanFinding finding : findings) {
            if (finding.getSeverity().isAtLeast(riskLevel)) {
                riskLevel = finding.getSeverity();
            }
        }

        if (!findings.isEmpty()) {
            log.warn("[Security] Injection scan found {} finding(s), risk={}", findings.size(),
                    riskLevel.getValue());
        }
        return ScanResult.builder()
                .clean(findings.isEmpty())
                .findings(findings)
                .riskLevel(riskLevel)
                .build();
    }

    /**
     * Scan raw text. Returns a mutable list of findings.
     */
    public List<ScanFinding> scanText(String text, String location) {
        List<ScanFinding> findings = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return findings;
        }

        String lower = text.toLowerCase(Locale.ROOT);
        matchRules(INSTRUCTION_OVERRIDE_PATTERNS, lower, location, findings);
        matchRules(ROLE_MANIPULATION_PATTERNS, lower, location, findings);
        matchRules(DATA_EXFILTRATION_PATTERNS, lower, location, findings);
        checkEncodingTricks(text, location, findings);
        checkDelimiterAttacks(text, location, findings);
        return findings;
    }

    private void matchRules(List<PatternRule> rules, String lower, String location, List<ScanFinding> findings) {
        for (PatternRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(lower);
            if (matcher.find()) {
                log.debug("[Security] Pattern matched: name={}, location={}", rule.name(), location);
                findings.add(ScanFinding.builder()
                        .patternName(rule.name())
                        .matchedText(matcher.group())
                        .location(location)
                        .severity(rule.severity())
                        .description(rule.description())
                        .build());
            }
        }
    }

    private void checkEncodingTricks(String text, String location, List<ScanFinding> findings) {
        Matcher zeroWidth = ZERO_WIDTH.matcher(text);
        int zeroWidthCount = 0;
        while (zeroWidth.find()) {
            zeroWidthCount++;
        }
        if (zeroWidthCount > 0) {
            findings.add(ScanFinding.builder()
                    .patternName("zero_width_chars")
                    .matchedText("Found " + zeroWidthCount + " zero-width character(s)")
                    .location(location)
                    .severity(Severity.MEDIUM)
                    .description("Zero-width characters detected, may hide injected content")
                    .build());
        }

        Matcher base64 = BASE64_TOKEN.matcher(text);
        while (base64.find()) {
            String token = base64.group();
            String decoded = decodeBase64(token);
            if (decoded != null && BASE64_KEYWORDS.stream().anyMatch(decoded::contains)) {
                findings.add(ScanFinding.builder()
                        .patternName("base64_injection")
                        .matchedText(truncate(token, 40) + "...")
                        .location(location)
                        .severity(Severity.HIGH)
                        .description("Base64-encoded suspicious content detected")
                        .build());
            }
        }
    }

    private void checkDelimiterAttacks(String text, String location, List<ScanFinding> findings) {
        Matcher codeBlocks = CODE_BLOCK.matcher(text);
        while (codeBlocks.find()) {
            String block = codeBlocks.group();
            String inner = block.replaceAll("^`+|`+$", "").toLowerCase(Locale.ROOT);
            if (containsAny(inner, DELIMITER_KEYWORDS)) {
                findings.add(ScanFinding.builder()
                        .patternName("code_block_injection")
                        .matchedText(truncate(block, 60) + "...")
                        .location(location)
                        .severity(Severity.HIGH)
                        .description("Instructions hidden in code block")
                        .build());
            }
        }

        Matcher tags = TAG_CONTENT.matcher(text);
        while (tags.find()) {
            String inner = tags.group(1);
            if (containsAny(inner.toLowerCase(Locale.ROOT), DELIMITER_KEYWORDS)) {
                findings.add(ScanFinding.builder()
                        .patternName("tag_injection")
                        .matchedText(truncate(inner, 60))
                        .location(location)
                        .severity(Severity.HIGH)
                        .description("Instructions hidden in XML/HTML tags")
                        .build());
            }
        }
    }

    private String decodeBase64(String token) {
        try {
            byte[] bytes = Base64.getDecoder().decode(token);
            return new String(bytes, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            log.trace("[Security] Skipping undecodable base64-like token: {}", e.getMessage());
            return null;
        }
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }

    private record PatternRule(String name, Pattern pattern, Severity severity, String description) {

        PatternRule(String name, String regex, Severity severity, String description) {
            this(name, Pattern.compile(regex), severity, description);
        }
    }
}
