package forecast.ml;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a fitted model or the {@link FitFailure} explaining why there is none.
 */
public final class FitResult {

    private final FittedModel model;
    private final FitFailure failure;

    private FitResult(FittedModel model, FitFailure failure) {
        this.model = model;
        this.failure = failure;
    }

    public static FitResult success(FittedModel model) {
        return new FitResult(Objects.requireNonNull(model), null);
    }

    public static FitResult failure(FitFailure failure) {
        return new FitResult(null, Objects.requireNonNull(failure));
    }

    public static FitResult failure(String modelName, String reason) {
        return failure(new FitFailure(modelName, reason));
    }

    public boolean isSuccess() {
        return model != null;
    }

    public Optional<FittedModel> model() {
        return Optional.ofNullable(model);
    }

    /** @throws IllegalStateException when this is a failure */
    public FittedModel get() {
        if (model == null) throw new IllegalStateException(failure.toString());
        return model;
    }

    public Optional<FitFailure> failure() {
        return Optional.ofNullable(failure);
    }
}
