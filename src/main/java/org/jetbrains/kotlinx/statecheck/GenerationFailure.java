package org.jetbrains.kotlinx.statecheck;

import org.jetbrains.kotlinx.statecheck.execution.GenerationException;

/**
 * The model offered an invalid command distribution while a sequence was generated,
 * so the run was aborted. There is nothing to minimize in this case.
 */
public class GenerationFailure extends StateCheckFailure {
    private final long trialSeed;
    private final GenerationException error;

    public GenerationFailure(long seed, long trialSeed, GenerationException error) {
        super(seed);
        this.trialSeed = trialSeed;
        this.error = error;
    }

    /**
     * The seed of the trial whose generation failed, see {@link StateCheckOptions#trialSeed(long)}.
     */
    public long getTrialSeed() {
        return trialSeed;
    }

    @Override
    public GenerationException getError() {
        return error;
    }

    @Override
    public String toString() {
        return "= Command generation failed =\n" +
            "Seed: " + getSeed() + ", trial seed: " + trialSeed + "\n" +
            "Error: " + error.getMessage();
    }
}
