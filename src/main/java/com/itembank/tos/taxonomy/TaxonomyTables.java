package com.itembank.tos.taxonomy;

import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.taxonomy.TaxonomyModels.KnowledgeDimension;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Lexical lookup tables shared by the classifier.
 * <p>
 * Scans over these tables are first-match-wins, so the declaration order of every
 * list below is part of the classification result and must not be re-sorted.
 */
public final class TaxonomyTables {

    public static final List<Map.Entry<String, CognitiveLevel>> LEVEL_CUE_VERBS = List.of(
            entry("define", CognitiveLevel.REMEMBERING), entry("list", CognitiveLevel.REMEMBERING),
            entry("recall", CognitiveLevel.REMEMBERING), entry("identify", CognitiveLevel.REMEMBERING),
            entry("name", CognitiveLevel.REMEMBERING), entry("state", CognitiveLevel.REMEMBERING),
            entry("recognize", CognitiveLevel.REMEMBERING), entry("select", CognitiveLevel.REMEMBERING),
            entry("match", CognitiveLevel.REMEMBERING), entry("choose", CognitiveLevel.REMEMBERING),
            entry("label", CognitiveLevel.REMEMBERING), entry("locate", CognitiveLevel.REMEMBERING),

            entry("explain", CognitiveLevel.UNDERSTANDING), entry("describe", CognitiveLevel.UNDERSTANDING),
            entry("summarize", CognitiveLevel.UNDERSTANDING), entry("interpret", CognitiveLevel.UNDERSTANDING),
            entry("classify", CognitiveLevel.UNDERSTANDING), entry("compare", CognitiveLevel.UNDERSTANDING),
            entry("contrast", CognitiveLevel.UNDERSTANDING), entry("illustrate", CognitiveLevel.UNDERSTANDING),
            entry("translate", CognitiveLevel.UNDERSTANDING), entry("paraphrase", CognitiveLevel.UNDERSTANDING),
            entry("convert", CognitiveLevel.UNDERSTANDING), entry("discuss", CognitiveLevel.UNDERSTANDING),

            entry("apply", CognitiveLevel.APPLYING), entry("use", CognitiveLevel.APPLYING),
            entry("execute", CognitiveLevel.APPLYING), entry("implement", CognitiveLevel.APPLYING),
            entry("solve", CognitiveLevel.APPLYING), entry("demonstrate", CognitiveLevel.APPLYING),
            entry("operate", CognitiveLevel.APPLYING), entry("calculate", CognitiveLevel.APPLYING),
            entry("show", CognitiveLevel.APPLYING), entry("complete", CognitiveLevel.APPLYING),
            entry("modify", CognitiveLevel.APPLYING), entry("relate", CognitiveLevel.APPLYING),

            entry("analyze", CognitiveLevel.ANALYZING), entry("examine", CognitiveLevel.ANALYZING),
            entry("investigate", CognitiveLevel.ANALYZING), entry("categorize", CognitiveLevel.ANALYZING),
            entry("differentiate", CognitiveLevel.ANALYZING), entry("distinguish", CognitiveLevel.ANALYZING),
            entry("organize", CognitiveLevel.ANALYZING), entry("deconstruct", CognitiveLevel.ANALYZING),
            entry("breakdown", CognitiveLevel.ANALYZING), entry("separate", CognitiveLevel.ANALYZING),
            entry("order", CognitiveLevel.ANALYZING), entry("connect", CognitiveLevel.ANALYZING),

            entry("evaluate", CognitiveLevel.EVALUATING), entry("assess", CognitiveLevel.EVALUATING),
            entry("judge", CognitiveLevel.EVALUATING), entry("critique", CognitiveLevel.EVALUATING),
            entry("justify", CognitiveLevel.EVALUATING), entry("defend", CognitiveLevel.EVALUATING),
            entry("support", CognitiveLevel.EVALUATING), entry("argue", CognitiveLevel.EVALUATING),
            entry("decide", CognitiveLevel.EVALUATING), entry("rate", CognitiveLevel.EVALUATING),
            entry("prioritize", CognitiveLevel.EVALUATING), entry("recommend", CognitiveLevel.EVALUATING),

            entry("create", CognitiveLevel.CREATING), entry("design", CognitiveLevel.CREATING),
            entry("develop", CognitiveLevel.CREATING), entry("construct", CognitiveLevel.CREATING),
            entry("generate", CognitiveLevel.CREATING), entry("produce", CognitiveLevel.CREATING),
            entry("plan", CognitiveLevel.CREATING), entry("compose", CognitiveLevel.CREATING),
            entry("formulate", CognitiveLevel.CREATING), entry("build", CognitiveLevel.CREATING),
            entry("invent", CognitiveLevel.CREATING), entry("combine", CognitiveLevel.CREATING)
    );

    public static final List<Map.Entry<String, KnowledgeDimension>> DIMENSION_CUE_VERBS = List.of(
            entry("define", KnowledgeDimension.FACTUAL), entry("list", KnowledgeDimension.FACTUAL),
            entry("name", KnowledgeDimension.FACTUAL), entry("identify", KnowledgeDimension.FACTUAL),
            entry("recall", KnowledgeDimension.FACTUAL), entry("recognize", KnowledgeDimension.FACTUAL),
            entry("select", KnowledgeDimension.FACTUAL), entry("match", KnowledgeDimension.FACTUAL),

            entry("explain", KnowledgeDimension.CONCEPTUAL), entry("classify", KnowledgeDimension.CONCEPTUAL),
            entry("compare", KnowledgeDimension.CONCEPTUAL), entry("summarize", KnowledgeDimension.CONCEPTUAL),
            entry("interpret", KnowledgeDimension.CONCEPTUAL), entry("illustrate", KnowledgeDimension.CONCEPTUAL),
            entry("contrast", KnowledgeDimension.CONCEPTUAL), entry("discuss", KnowledgeDimension.CONCEPTUAL),

            entry("apply", KnowledgeDimension.PROCEDURAL), entry("use", KnowledgeDimension.PROCEDURAL),
            entry("implement", KnowledgeDimension.PROCEDURAL), entry("execute", KnowledgeDimension.PROCEDURAL),
            entry("demonstrate", KnowledgeDimension.PROCEDURAL), entry("calculate", KnowledgeDimension.PROCEDURAL),
            entry("solve", KnowledgeDimension.PROCEDURAL), entry("operate", KnowledgeDimension.PROCEDURAL),
            entry("construct", KnowledgeDimension.PROCEDURAL),

            entry("evaluate", KnowledgeDimension.METACOGNITIVE), entry("assess", KnowledgeDimension.METACOGNITIVE),
            entry("judge", KnowledgeDimension.METACOGNITIVE), entry("critique", KnowledgeDimension.METACOGNITIVE),
            entry("justify", KnowledgeDimension.METACOGNITIVE), entry("reflect", KnowledgeDimension.METACOGNITIVE),
            entry("plan", KnowledgeDimension.METACOGNITIVE), entry("monitor", KnowledgeDimension.METACOGNITIVE)
    );

    public static final List<Map.Entry<KnowledgeDimension, List<String>>> DIMENSION_INDICATORS = List.of(
            entry(KnowledgeDimension.FACTUAL, List.of("what is", "define", "list", "name", "identify", "when",
                    "where", "who", "which", "what year", "how many")),
            entry(KnowledgeDimension.CONCEPTUAL, List.of("explain", "compare", "contrast", "relationship", "why",
                    "how does", "principle", "theory", "model", "framework")),
            entry(KnowledgeDimension.PROCEDURAL, List.of("calculate", "solve", "demonstrate", "perform", "how to",
                    "steps", "procedure", "method", "algorithm")),
            entry(KnowledgeDimension.METACOGNITIVE, List.of("evaluate", "assess", "best method", "most appropriate",
                    "strategy", "approach", "reflect", "monitor"))
    );

    public static final List<String> EASY_KEYWORDS = List.of(
            "simple", "basic", "elementary", "straightforward", "fundamental");

    public static final List<String> DIFFICULT_KEYWORDS = List.of(
            "complex", "advanced", "sophisticated", "intricate", "comprehensive");

    private TaxonomyTables() {}
}
