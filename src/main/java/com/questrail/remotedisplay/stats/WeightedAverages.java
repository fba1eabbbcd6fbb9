package com.questrail.remotedisplay.stats;

/**
 * Long-term and recent time-weighted averages of the same series.
 *
 * @param average long-term average, weights decay as {@code 1/(1+age)}
 * @param recent  recent average, weights decay as {@code 1/(0.1+age^2)}
 */
public record WeightedAverages(double average, double recent)
{
}
