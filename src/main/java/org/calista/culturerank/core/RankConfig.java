package org.calista.culturerank.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.culturerank.explain.ExplainThresholds;
import org.calista.culturerank.io.FileIO;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.model.ScoreWeights;
import org.calista.culturerank.pipeline.RankParams;
import org.calista.culturerank.policy.SurfacePolicy;
import org.calista.culturerank.policy.SurfacePolicyTable;
import org.calista.culturerank.rerank.DppParams;
import org.calista.culturerank.score.CvsWeights;
import org.calista.culturerank.score.ScoringParams;
import org.calista.culturerank.score.SliderParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ranking configuration file:
 * - defaults live in the fields
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() normalizes values in place
 * - toParams() / toPolicies() turn it into the immutable objects the pipeline uses
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RankConfig {

    private static final Logger log = LoggerFactory.getLogger(RankConfig.class);

    public Weights weights = new Weights();
    public Diversity diversity = new Diversity();
    public Scoring scoring = new Scoring();
    public Slider slider = new Slider();
    public Dpp dpp = new Dpp();
    public Explain explain = new Explain();

    /** Surface name to filter. Entries are layered over the built-in table. */
    public Map<String, Surface> surfaces = new LinkedHashMap<>();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Weights {
        public double prs = 0.55;
        public double cvs = 0.25;
        public double dns = 0.20;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Diversity {
        public int capN = 20;
        public int capK = 5;
        public double explorationBudget = 0.15;
        public double mmrSimilarityPenalty = 0.3;
        public int rerankMaxCandidates = 200;
        public String strategy = "MMR";
        public int newClusterExposureMax = 2;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Scoring {
        public Cvs cvs = new Cvs();
        public double clusterNoveltyFactor = 0.06;
        public double timeHalfLifeHours = 72.0;
        public double dnsClusterNoveltyWeight = 0.6;
        public double dnsTimeNoveltyWeight = 0.4;
        public double spamPenalty = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Cvs {
        public double like = 0.35;
        public double context = 0.25;
        public double collection = 0.15;
        public double bridge = 0.15;
        public double sustain = 0.10;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Slider {
        public double deltaMax = 0.10;
        public double minWeight = 0.05;
        public double maxWeight = 0.90;
        public int maxIterations = 3;
        public double dnsRatio = 0.6;
        public double cvsRatio = 0.4;
        public double effectiveKMinMultiplier = 0.5;
        public double effectiveKMaxMultiplier = 1.5;
        public double explorationMinMultiplier = 0.5;
        public double explorationMaxMultiplier = 1.5;
        public double explorationBudgetMin = 0.0;
        public double explorationBudgetMax = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Dpp {
        public double qualityWeight = 1.0;
        public double diversityWeight = 0.7;
        public double temperature = 1.0;
        public double regularization = 1e-6;
        public int maxKernelSize = 100;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Explain {
        public double contextHigh = 0.70;
        public double bridgeHigh = 0.70;
        public double supportDensityHigh = 0.15;
        public int newClusterExposureLimit = 2;
        public double prsSimilarityMin = 0.65;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Surface {
        public boolean requireModerated = true;
        public boolean excludeNsfw = false;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced by the defaults, written to disk.
     */
    public static RankConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        Optional<String> existing = io.readStringIfExists(configFile);
        if (existing.isEmpty()) {
            RankConfig created = new RankConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        String json = existing.get();
        if (json.isBlank()) {
            RankConfig created = new RankConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        RankConfig cfg = mapper.readValue(json, RankConfig.class);
        if (cfg == null) throw new IllegalStateException("Config root of " + configFile + " is null");

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, RankConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, RankConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (weights == null) weights = new Weights();
        if (!Double.isFinite(weights.prs) || !Double.isFinite(weights.cvs) || !Double.isFinite(weights.dns)) {
            log.warn("Non-finite weights in config, using defaults");
            weights = new Weights();
        }

        if (diversity == null) diversity = new Diversity();
        if (diversity.capN < 0) diversity.capN = 0;
        if (diversity.capK < 1) diversity.capK = 1;
        if (!Double.isFinite(diversity.explorationBudget)) diversity.explorationBudget = 0.15;
        if (diversity.explorationBudget < 0.0) diversity.explorationBudget = 0.0;
        if (diversity.explorationBudget > 1.0) diversity.explorationBudget = 1.0;
        if (!Double.isFinite(diversity.mmrSimilarityPenalty)) diversity.mmrSimilarityPenalty = 0.3;
        if (diversity.rerankMaxCandidates < 1) diversity.rerankMaxCandidates = 1;
        if (diversity.newClusterExposureMax < 0) diversity.newClusterExposureMax = 0;
        if (strategyOf(diversity.strategy) == null) {
            log.warn("Unknown rerank strategy '{}', using MMR", diversity.strategy);
            diversity.strategy = "MMR";
        }

        if (scoring == null) scoring = new Scoring();
        if (scoring.cvs == null) scoring.cvs = new Cvs();
        if (!(scoring.clusterNoveltyFactor >= 0.0) || !Double.isFinite(scoring.clusterNoveltyFactor)) scoring.clusterNoveltyFactor = 0.06;
        if (!(scoring.timeHalfLifeHours > 0.0) || !Double.isFinite(scoring.timeHalfLifeHours)) scoring.timeHalfLifeHours = 72.0;
        if (!(scoring.spamPenalty >= 0.0 && scoring.spamPenalty <= 1.0)) scoring.spamPenalty = 0.5;

        if (slider == null) slider = new Slider();
        if (slider.maxIterations < 1) slider.maxIterations = 1;
        if (!(slider.minWeight > 0.0) || !(slider.maxWeight > slider.minWeight) || slider.maxWeight > 1.0) {
            log.warn("Invalid slider weight bounds [{}, {}], using defaults", slider.minWeight, slider.maxWeight);
            slider.minWeight = 0.05;
            slider.maxWeight = 0.90;
        }
        if (slider.explorationBudgetMin < 0.0) slider.explorationBudgetMin = 0.0;
        if (slider.explorationBudgetMax < slider.explorationBudgetMin) slider.explorationBudgetMax = slider.explorationBudgetMin;

        if (dpp == null) dpp = new Dpp();
        if (!(dpp.qualityWeight > 0.0)) dpp.qualityWeight = 1.0;
        if (!(dpp.diversityWeight >= 0.0) || dpp.diversityWeight > 1.0) dpp.diversityWeight = 0.7;
        if (!(dpp.temperature > 0.0)) dpp.temperature = 1.0;
        if (!(dpp.regularization >= 0.0)) dpp.regularization = 1e-6;
        if (dpp.maxKernelSize < 1) dpp.maxKernelSize = 100;

        if (explain == null) explain = new Explain();
        if (explain.newClusterExposureLimit < 0) explain.newClusterExposureLimit = 0;

        if (surfaces == null) surfaces = new LinkedHashMap<>();
        surfaces.values().removeIf(Objects::isNull);
    }

    // -------------------- Conversion --------------------

    public RankParams toParams() {
        return RankParams.builder()
                .weights(ScoreWeights.of(weights.prs, weights.cvs, weights.dns))
                .diversityCapN(diversity.capN)
                .diversityCapK(diversity.capK)
                .explorationBudget(diversity.explorationBudget)
                .mmrSimilarityPenalty(diversity.mmrSimilarityPenalty)
                .rerankMaxCandidates(diversity.rerankMaxCandidates)
                .rerankStrategy(strategyOf(diversity.strategy))
                .newClusterExposureMax(diversity.newClusterExposureMax)
                .scoring(ScoringParams.builder()
                        .cvsWeights(new CvsWeights(scoring.cvs.like, scoring.cvs.context, scoring.cvs.collection,
                                scoring.cvs.bridge, scoring.cvs.sustain))
                        .clusterNoveltyFactor(scoring.clusterNoveltyFactor)
                        .timeHalfLifeHours(scoring.timeHalfLifeHours)
                        .dnsClusterNoveltyWeight(scoring.dnsClusterNoveltyWeight)
                        .dnsTimeNoveltyWeight(scoring.dnsTimeNoveltyWeight)
                        .spamPenalty(scoring.spamPenalty)
                        .build())
                .slider(SliderParams.builder()
                        .deltaMax(slider.deltaMax)
                        .minWeight(slider.minWeight)
                        .maxWeight(slider.maxWeight)
                        .maxIterations(slider.maxIterations)
                        .dnsRatio(slider.dnsRatio)
                        .cvsRatio(slider.cvsRatio)
                        .effectiveKMinMultiplier(slider.effectiveKMinMultiplier)
                        .effectiveKMaxMultiplier(slider.effectiveKMaxMultiplier)
                        .explorationMinMultiplier(slider.explorationMinMultiplier)
                        .explorationMaxMultiplier(slider.explorationMaxMultiplier)
                        .explorationBudgetMin(slider.explorationBudgetMin)
                        .explorationBudgetMax(slider.explorationBudgetMax)
                        .build())
                .dpp(DppParams.builder()
                        .qualityWeight(dpp.qualityWeight)
                        .diversityWeight(dpp.diversityWeight)
                        .temperature(dpp.temperature)
                        .regularization(dpp.regularization)
                        .maxKernelSize(dpp.maxKernelSize)
                        .build())
                .explain(new ExplainThresholds(explain.contextHigh, explain.bridgeHigh, explain.supportDensityHigh,
                        explain.newClusterExposureLimit, explain.prsSimilarityMin))
                .build();
    }

    public SurfacePolicyTable toPolicies() {
        TreeMap<String, SurfacePolicy> m = new TreeMap<>();
        surfaces.forEach((name, s) -> m.put(name, new SurfacePolicy(s.requireModerated, s.excludeNsfw)));
        return SurfacePolicyTable.defaultsWith(m);
    }

    static DiversityStrategy strategyOf(String name) {
        if (name == null || name.isBlank()) return DiversityStrategy.MMR;
        for (DiversityStrategy s : DiversityStrategy.values()) {
            if (s.name().equalsIgnoreCase(name.trim())) return s;
        }
        return null;
    }
}
