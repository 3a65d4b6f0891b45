package org.ohnlp.cdm.timeline;

import org.ohnlp.cdm.timeline.cache.CacheKey;
import org.ohnlp.cdm.timeline.cache.TimelineCache;
import org.ohnlp.cdm.timeline.cache.TimelineSnapshot;
import org.ohnlp.cdm.timeline.concurrent.PersonPartitionExecutor;
import org.ohnlp.cdm.timeline.ehr.EventAttacher;
import org.ohnlp.cdm.timeline.ehr.parsers.BasicInfoAssembler;
import org.ohnlp.cdm.timeline.ehr.parsers.ParseContext;
import org.ohnlp.cdm.timeline.ehr.parsers.TableParser;
import org.ohnlp.cdm.timeline.ehr.tables.TableReader;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.mapping.VocabularyMapper;
import org.ohnlp.cdm.timeline.structs.Event;
import org.ohnlp.cdm.timeline.structs.Timeline;
import org.ohnlp.cdm.timeline.structs.VocabularyRegistry;
import org.ohnlp.cdm.timeline.tasks.SampleDataset;
import org.ohnlp.cdm.timeline.tasks.TaskFunction;
import org.ohnlp.cdm.timeline.tasks.TaskSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the person timeline of an OMOP CDM extract.
 * <pre>
 * timeline: person_id -> Person
 *     Person: birth, death, gender, ethnicity, episodes in encounter order
 *         Episode: encounter and discharge time, discharge status, table -> events by timestamp
 *             Event: code, vocabulary, timestamp, attributes
 * </pre>
 * The person, visit_occurrence and death tables are always read; clinical tables are read when requested. Results
 * are cached under a hash of the configuration unless caching is disabled.
 */
public class TimelineDataset {
    private static final Logger LOG = LoggerFactory.getLogger(TimelineDataset.class);

    private final TimelineDatasetConfig config;
    private final List<TableParser> parsers;
    private final CacheKey cacheKey;

    /**
     * @throws ConfigurationException if the configuration is incomplete or requests a basic table
     * @throws org.ohnlp.cdm.timeline.exceptions.MissingTableParserException if a requested table has no parser
     */
    public TimelineDataset(TimelineDatasetConfig config) {
        if (config.getDataConnection() == null) {
            throw new ConfigurationException("Either a source root or a database connection must be configured");
        }
        if (!config.getCodeMapping().isEmpty() && config.getMappingService() == null) {
            throw new ConfigurationException("Code mapping " + config.getCodeMapping()
                    + " is configured without a mapping service");
        }
        this.config = config;
        // Validate the whole request before touching any data
        this.parsers = config.getParserRegistry().resolve(config.getTables());
        this.cacheKey = CacheKey.of(config.getDatasetName(), config.getDataConnection().describe(),
                config.getTables(), config.getCodeMapping(), personRowLimit());
    }

    /**
     * Returns the cached timeline for this configuration if there is one and no refresh was asked for, otherwise
     * builds it from the source tables and caches it.
     * @throws org.ohnlp.cdm.timeline.exceptions.CacheCorruptionException if the cached artifact is unreadable
     */
    public TimelineResult load() {
        TimelineCache cache = new TimelineCache(config.getCacheDirectory());
        if (config.isCacheEnabled() && !config.isRefreshCache()) {
            Optional<TimelineSnapshot> cached = cache.read(cacheKey);
            if (cached.isPresent()) {
                LOG.info("Loaded {} base dataset from {}", config.getDatasetName(), cache.pathFor(cacheKey));
                return new TimelineResult(config.getDatasetName(), cached.get().getTimeline(),
                        cached.get().getRegistry(), new RunReport(), true);
            }
        }
        LOG.info("Processing {} base dataset...", config.getDatasetName());
        TimelineResult result = build();
        if (config.isCacheEnabled()) {
            int skipped = result.getReport().getUnitFailures().size();
            if (skipped > 0) {
                LOG.warn("Not caching {} base dataset: {} persons were skipped after unit failures",
                        config.getDatasetName(), skipped);
            } else {
                cache.write(cacheKey, new TimelineSnapshot(result.getTimeline(), result.getRegistry()));
                LOG.info("Saved {} base dataset to {}", config.getDatasetName(), cache.pathFor(cacheKey));
            }
        }
        return result;
    }

    /**
     * Loads the timeline and turns it into task samples.
     */
    public SampleDataset generateSamples(TaskFunction task, String taskName) {
        return new TaskSampler().sample(load(), task, taskName);
    }

    TimelineResult build() {
        RunReport report = new RunReport();
        VocabularyRegistry registry = new VocabularyRegistry();
        try (PersonPartitionExecutor executor =
                     new PersonPartitionExecutor(config.getWorkers(), config.isTolerateUnitFailures())) {
            ParseContext context = new ParseContext(new TableReader(config.getDataConnection()), executor, registry);

            long tic = System.currentTimeMillis();
            Timeline timeline = new BasicInfoAssembler().assemble(context, personRowLimit());
            LOG.info("Finished basic patient information parsing: {} persons, {} episodes in {}ms",
                    timeline.size(), timeline.getEpisodeCount(), System.currentTimeMillis() - tic);

            EventAttacher attacher = new EventAttacher();
            for (TableParser parser : parsers) {
                tic = System.currentTimeMillis();
                Map<String, List<Event>> events = parser.parse(context);
                report.addAttachment(attacher.attach(timeline, parser.getTable(), events));
                LOG.info("Finished parsing {} in {}ms", parser.getTable(), System.currentTimeMillis() - tic);
            }
            report.addUnitFailures(context.getFailures());

            VocabularyMapper.MappingResult mapped =
                    new VocabularyMapper(config.getMappingService()).map(timeline, registry, config.getCodeMapping());
            report.setMapping(mapped.getReport());
            return new TimelineResult(config.getDatasetName(), mapped.getTimeline(), mapped.getRegistry(),
                    report, false);
        }
    }

    private Integer personRowLimit() {
        return config.isDev() ? config.getDevRowLimit() : null;
    }

    public CacheKey getCacheKey() {
        return cacheKey;
    }

    public TimelineDatasetConfig getConfig() {
        return config;
    }
}
