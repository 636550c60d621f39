package forecast.eval;

import forecast.data.TimeSeries;

/**
 * Temporal split: train is the oldest part, test the most recent. Never shuffled.
 */
public final class TrainTestSplit {

    private final TimeSeries train;
    private final TimeSeries test;

    TrainTestSplit(TimeSeries train, TimeSeries test) {
        this.train = train;
        this.test = test;
    }

    public TimeSeries getTrain() { return train; }
    public TimeSeries getTest() { return test; }
}
