package org.carball.querylens.aggregator;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.alert.AlertDispatcher;
import org.carball.querylens.analyzer.ExecutionPlanProvider;
import org.carball.querylens.analyzer.PatternTracker;
import org.carball.querylens.backtrace.ApplicationFrames;
import org.carball.querylens.backtrace.BacktraceCollector;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.Frame;
import org.carball.querylens.parser.SqlNormalizer;
import org.carball.querylens.parser.TableNameExtractor;
import org.carball.querylens.storage.JsonFileQueryStore;

import java.time.Clock;
import java.util.function.Predicate;

/**
 * Engine wiring shared by every request: configuration, store, alert dispatcher,
 * plan provider and the host hooks. Request state lives in the
 * {@link RequestAggregator}s it creates.
 */
@Slf4j
@Getter
public class QueryLens {

    private final QueryLensConfig config;
    private final Clock clock;
    private final SqlNormalizer normalizer;
    private final TableNameExtractor tableNames;
    private final JsonFileQueryStore store;
    private final AlertDispatcher alerts;
    private final ExecutionPlanProvider planProvider;
    private final MetadataProvider metadataProvider;
    private final Predicate<Frame> applicationFrames;
    private final BacktraceCollector backtraceCollector;
    private final Sampler sampler;
    private final QueryExclusions exclusions;
    private final TrackedConnections trackedConnections;

    /**
     * Every collaborator except the configuration is optional and falls back to
     * the built-in implementation.
     */
    @Builder
    private QueryLens(QueryLensConfig config,
                      Clock clock,
                      JsonFileQueryStore store,
                      AlertDispatcher alerts,
                      ExecutionPlanProvider planProvider,
                      MetadataProvider metadataProvider,
                      Predicate<Frame> applicationFrames,
                      Sampler sampler) {
        if (config == null) {
            throw new IllegalArgumentException("A configuration is required");
        }
        this.config = config.validate();
        this.clock = clock != null ? clock : Clock.systemDefaultZone();
        this.normalizer = new SqlNormalizer();
        this.tableNames = new TableNameExtractor();
        this.store = store != null ? store : JsonFileQueryStore.fromConfig(config, this.clock);
        this.alerts = alerts != null ? alerts : AlertDispatcher.create(config);
        this.planProvider = planProvider != null ? planProvider : ExecutionPlanProvider.none();
        this.metadataProvider = metadataProvider != null ? metadataProvider : MetadataProvider.none();
        this.applicationFrames = applicationFrames != null ? applicationFrames : ApplicationFrames.repositoriesAndServices();
        this.sampler = sampler != null ? sampler : Sampler.percentage(config.getSamplingPercent());
        this.backtraceCollector = new BacktraceCollector(config.getBacktraceExcludePrefixes(),
                config.getBacktraceLimit(), this.applicationFrames);
        this.exclusions = new QueryExclusions(config.getExcludePatterns());
        this.trackedConnections = new TrackedConnections(config.getConnections());

        log.debug("Query Lens engine ready: {}", config.getConfigurationSummary());
    }

    public static QueryLens create(QueryLensConfig config) {
        return QueryLens.builder().config(config).build();
    }

    public RequestAggregator newAggregator() {
        return new RequestAggregator(this);
    }

    PatternTracker newPatternTracker() {
        return new PatternTracker(config, normalizer, tableNames, planProvider, alerts, applicationFrames, clock);
    }
}
