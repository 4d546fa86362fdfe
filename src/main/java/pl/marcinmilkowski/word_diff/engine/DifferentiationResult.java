package pl.marcinmilkowski.word_diff.engine;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of one {@link DifferentiationRun}.
 *
 * <p>The provenance forest is only present for terminated runs; the diagnostic only
 * for exhausted ones.</p>
 */
public final class DifferentiationResult {

    private final RepetitionPolicy policy;
    private final BigInteger score;
    private final RunStatus status;
    private final Diagnostic diagnostic;
    private final ProvenanceForest provenanceForest;
    private final List<String> trace;

    DifferentiationResult(RepetitionPolicy policy, BigInteger score, RunStatus status,
                          Diagnostic diagnostic, ProvenanceForest provenanceForest, List<String> trace) {
        this.policy = policy;
        this.score = score;
        this.status = status;
        this.diagnostic = diagnostic;
        this.provenanceForest = provenanceForest;
        this.trace = List.copyOf(trace);
    }

    public RepetitionPolicy getPolicy() {
        return policy;
    }

    public BigInteger getScore() {
        return score;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Optional<Diagnostic> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    public Optional<ProvenanceForest> getProvenanceForest() {
        return Optional.ofNullable(provenanceForest);
    }

    public List<String> getTrace() {
        return trace;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("policy", policy.getAbbreviation());
        obj.put("score", score);
        obj.put("status", status.kind().name().toLowerCase(Locale.ROOT));
        obj.put("level", status.level());
        if (diagnostic != null) {
            JSONObject diag = new JSONObject();
            diag.put("level", diagnostic.level());
            diag.put("count", diagnostic.count());
            obj.put("diagnostic", diag);
        }
        if (provenanceForest != null) {
            obj.put("forest_size", provenanceForest.size());
        }
        if (!trace.isEmpty()) {
            obj.put("trace", new JSONArray(trace));
        }
        return obj;
    }

    @Override
    public String toString() {
        return String.format("%s[score=%d, status=%s%s]", policy.getAbbreviation(), score, status,
            diagnostic != null ? ", diagnostic=" + diagnostic : "");
    }

    /**
     * Level in {@code [1, maxLevel]} with the fewest unique occurrences left, reported for exhausted runs.
     *
     * @param level level with the smallest {@code |U[level,A]| + |U[level,B]|}
     * @param count that smallest total
     */
    public record Diagnostic(int level, BigInteger count) {
    }
}
