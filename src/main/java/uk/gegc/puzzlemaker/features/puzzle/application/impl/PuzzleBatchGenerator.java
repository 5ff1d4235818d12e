package uk.gegc.puzzlemaker.features.puzzle.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.puzzle.application.PuzzleGenerationService;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.BatchGenerationRequest;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.BatchGenerationResult;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.BatchItemFailure;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.DifficultyProgression;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.GenerationResult;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleGenerationRequest;
import uk.gegc.puzzlemaker.shared.config.GenerationConfig;
import uk.gegc.puzzlemaker.shared.exception.PuzzleGenerationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.random.RandomGenerator;

/**
 * Generates a run of puzzles with a difficulty progression. Items run on the batch
 * executor, whose pool size bounds concurrency. A failed item is recorded, not thrown.
 */
@Service
@Slf4j
public class PuzzleBatchGenerator {

    private final PuzzleGenerationService generationService;
    private final Executor batchExecutor;
    private final GenerationConfig config;
    private final RandomGenerator random;

    @Autowired
    public PuzzleBatchGenerator(PuzzleGenerationService generationService,
                                @Qualifier("puzzleBatchExecutor") Executor batchExecutor,
                                GenerationConfig config) {
        this(generationService, batchExecutor, config, new Random());
    }

    PuzzleBatchGenerator(PuzzleGenerationService generationService,
                         Executor batchExecutor,
                         GenerationConfig config,
                         RandomGenerator random) {
        this.generationService = generationService;
        this.batchExecutor = batchExecutor;
        this.config = config;
        this.random = random;
    }

    public BatchGenerationResult generateBatch(BatchGenerationRequest request) {
        if (request == null || request.count() < 1) {
            throw new IllegalArgumentException("Batch count must be at least 1");
        }
        DifficultyProgression progression = request.progression() != null
                ? request.progression()
                : DifficultyProgression.CONSTANT;

        log.info("Generating batch of {} puzzles from difficulty {} ({})",
                request.count(), request.startDifficulty(), progression);

        List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < request.count(); i++) {
            int index = i;
            int difficulty = progression.difficultyFor(i, request.count(), request.startDifficulty(), random);
            PuzzleGenerationRequest itemRequest = PuzzleGenerationRequest.builder()
                    .targetDifficulty(difficulty)
                    .category(request.category())
                    .requireNovelty(request.ensureVariety())
                    .maxAttempts(config.getBatchMaxAttempts())
                    .puzzleType(request.puzzleType())
                    .build();
            futures.add(CompletableFuture.supplyAsync(() -> generateItem(index, itemRequest), batchExecutor));
        }

        List<GenerationResult> results = new ArrayList<>();
        List<BatchItemFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            ItemOutcome outcome;
            try {
                outcome = futures.get(i).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                outcome = ItemOutcome.failed(new BatchItemFailure(i, -1, cause.getMessage(), null));
            }
            if (outcome.result() != null) {
                results.add(outcome.result());
            } else {
                failures.add(outcome.failure());
            }
        }

        int distinctPatterns = (int) results.stream()
                .map(GenerationResult::patternType)
                .filter(Objects::nonNull)
                .distinct()
                .count();

        log.info("Batch complete: {} generated, {} failed, {} distinct patterns",
                results.size(), failures.size(), distinctPatterns);
        return new BatchGenerationResult(results, failures, distinctPatterns);
    }

    private ItemOutcome generateItem(int index, PuzzleGenerationRequest request) {
        try {
            return ItemOutcome.succeeded(generationService.generate(request));
        } catch (PuzzleGenerationException e) {
            log.warn("Batch item {} failed: {}", index, e.getReason());
            return ItemOutcome.failed(new BatchItemFailure(index, request.targetDifficulty(), e.getReason(),
                    e.getBestScore()));
        } catch (RuntimeException e) {
            log.error("Batch item {} failed", index, e);
            return ItemOutcome.failed(new BatchItemFailure(index, request.targetDifficulty(), e.getMessage(), null));
        }
    }

    private record ItemOutcome(GenerationResult result, BatchItemFailure failure) {

        static ItemOutcome succeeded(GenerationResult result) {
            return new ItemOutcome(result, null);
        }

        static ItemOutcome failed(BatchItemFailure failure) {
            return new ItemOutcome(null, failure);
        }
    }
}
