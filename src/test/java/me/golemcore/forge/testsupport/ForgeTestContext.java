package me.golemcore.forge.testsupport;

import me.golemcore.forge.adapter.outbound.storage.InMemoryRecordStoreAdapter;
import me.golemcore.forge.domain.model.PromptSection;
import me.golemcore.forge.domain.model.SectionedDocument;
import me.golemcore.forge.domain.service.CompositionService;
import me.golemcore.forge.domain.service.ContentMerger;
import me.golemcore.forge.domain.service.PromptRegistryService;
import me.golemcore.forge.domain.service.PromptResolver;
import me.golemcore.forge.domain.service.PromptTemplateEngine;
import me.golemcore.forge.domain.service.RecordMapper;
import me.golemcore.forge.domain.service.RegressionGuard;
import me.golemcore.forge.domain.service.StructuralDiffer;
import me.golemcore.forge.domain.service.UsageLogService;
import me.golemcore.forge.domain.service.VersionControlService;
import me.golemcore.forge.infrastructure.config.ForgeAutoConfiguration;
import me.golemcore.forge.infrastructure.config.ForgeProperties;
import me.golemcore.forge.security.InjectionScanner;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the real services over an in-memory record store, the way the
 * application context does.
 */
public final class ForgeTestContext {

    public static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final ForgeProperties properties = new ForgeProperties();
    public final RecordMapper recordMapper = new RecordMapper(ForgeAutoConfiguration.objectMapper());
    public final InMemoryRecordStoreAdapter store = new InMemoryRecordStoreAdapter(clock);
    public final InjectionScanner scanner = new InjectionScanner(properties);
    public final ContentMerger merger = new ContentMerger();
    public final RegressionGuard regressionGuard = new RegressionGuard(recordMapper);
    public final StructuralDiffer differ = new StructuralDiffer(recordMapper);
    public final VersionControlService versionControl = new VersionControlService(store, scanner,
            regressionGuard, merger, differ, recordMapper, properties);
    public final PromptRegistryService registry = new PromptRegistryService(store, versionControl, scanner,
            recordMapper);
    public final UsageLogService usageLog = new UsageLogService(store, registry, recordMapper);
    public final PromptResolver resolver = new PromptResolver(registry, versionControl, usageLog);
    public final PromptTemplateEngine templateEngine = new PromptTemplateEngine();
    public final CompositionService composition = new CompositionService(resolver, registry, templateEngine,
            recordMapper, clock);

    /**
     * Sectioned content from alternating id/content pairs.
     */
    public static Map<String, Object> sections(String... idContentPairs) {
        return sectionsWith(Map.of(), idContentPairs);
    }

    public static Map<String, Object> sectionsWith(Map<String, Object> variables, String... idContentPairs) {
        List<PromptSection> sections = new ArrayList<>();
        for (int i = 0; i + 1 < idContentPairs.length; i += 2) {
            sections.add(PromptSection.builder()
                    .id(idContentPairs[i])
                    .label(idContentPairs[i])
                    .content(idContentPairs[i + 1])
                    .build());
        }
        return SectionedDocument.assemble(sections, new LinkedHashMap<>(variables), new LinkedHashMap<>());
    }
}
