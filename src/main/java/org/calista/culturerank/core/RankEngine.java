package org.calista.culturerank.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.culturerank.fingerprint.ParamFingerprint;
import org.calista.culturerank.io.FileIO;
import org.calista.culturerank.model.RankRequest;
import org.calista.culturerank.model.RankResponse;
import org.calista.culturerank.pipeline.FeedRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Process-scoped container: config, JSON mapper and the ranker built from them.
 *
 * Lifecycle:
 *   1) builder().build(configFile)  -> loadOrCreate config, build params, policies, fingerprint
 *   2) rank(...)                    -> any number of independent calls
 */
public final class RankEngine {

    private static final Logger log = LoggerFactory.getLogger(RankEngine.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final RankConfig cfg;
    private final FeedRanker ranker;

    private RankEngine(FileIO io, ObjectMapper mapper, RankConfig cfg, FeedRanker ranker) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
    }

    public static Builder builder() {
        return new Builder();
    }

    public FileIO io() {
        return io;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public RankConfig config() {
        return cfg;
    }

    public FeedRanker ranker() {
        return ranker;
    }

    public RankResponse rank(RankRequest request) {
        return ranker.rank(request);
    }

    /** Request JSON in, pretty response JSON out. */
    public String rankJson(String requestJson) throws IOException {
        Objects.requireNonNull(requestJson, "requestJson");
        RankRequest request = mapper.readValue(requestJson, RankRequest.class);
        if (request == null) throw new IllegalArgumentException("Request JSON is null");
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(rank(request));
    }

    public String rankFile(Path requestFile) throws IOException {
        return rankJson(io.readString(requestFile));
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;
        private ObjectMapper mapper;
        private ParamFingerprint fingerprint;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder fingerprint(ParamFingerprint fingerprint) {
            this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
            return this;
        }

        /** Loads (or creates) the config file and wires the ranker. */
        public RankEngine build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");
            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            FileIO io = new FileIO(charset, true);

            RankConfig cfg = RankConfig.loadOrCreate(io, configFile, om);
            return build(io, om, cfg, configFile.toString());
        }

        /** Wires the ranker from an in-memory config; nothing is read or written. */
        public RankEngine build(RankConfig cfg) {
            Objects.requireNonNull(cfg, "cfg");
            cfg.validate();
            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            return build(new FileIO(charset, true), om, cfg, "<memory>");
        }

        private RankEngine build(FileIO io, ObjectMapper om, RankConfig cfg, String source) {
            ParamFingerprint fp = (this.fingerprint != null) ? this.fingerprint : ParamFingerprint.createDefault();
            FeedRanker ranker = new FeedRanker(cfg.toParams(), cfg.toPolicies(), fp);

            log.info("RankEngine created: config={}, params={}, fingerprint={}", source, ranker.defaults(), fp.hasher().algorithm());
            return new RankEngine(io, om, cfg, ranker);
        }

        public static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }
}
