package qseries.core;

/**
 * Search bounds shared by every workflow.
 *
 * <p>Exact rational arithmetic grows without limit, so each search is capped here rather than by
 * a memory ceiling. Lower the caps to trade completeness for cost.
 */
public record TelescopingOptions(
    int maxOrder,
    int maxSearchIndex,
    int maxSumTerms,
    int maxCandidateProduct,
    int maxTrialDivisor,
    int verifyWindow) {

  public static TelescopingOptions defaults() {
    return new TelescopingOptions(3, 50, 100, 5000, 10_000, 10);
  }

  public static TelescopingOptions normalize(TelescopingOptions options) {
    if (options == null) {
      return defaults();
    }
    TelescopingOptions defaults = defaults();
    int maxOrder = options.maxOrder() > 0 ? options.maxOrder() : defaults.maxOrder();
    int maxSearchIndex =
        options.maxSearchIndex() > 0 ? options.maxSearchIndex() : defaults.maxSearchIndex();
    int maxSumTerms = options.maxSumTerms() > 0 ? options.maxSumTerms() : defaults.maxSumTerms();
    int maxCandidateProduct =
        options.maxCandidateProduct() > 0
            ? options.maxCandidateProduct()
            : defaults.maxCandidateProduct();
    int maxTrialDivisor =
        options.maxTrialDivisor() > 0 ? options.maxTrialDivisor() : defaults.maxTrialDivisor();
    int verifyWindow = Math.max(0, options.verifyWindow());
    return new TelescopingOptions(
        maxOrder, maxSearchIndex, maxSumTerms, maxCandidateProduct, maxTrialDivisor, verifyWindow);
  }

  public TelescopingOptions withMaxOrder(int maxOrder) {
    return new TelescopingOptions(
        maxOrder, maxSearchIndex, maxSumTerms, maxCandidateProduct, maxTrialDivisor, verifyWindow);
  }

  public TelescopingOptions withVerifyWindow(int verifyWindow) {
    return new TelescopingOptions(
        maxOrder, maxSearchIndex, maxSumTerms, maxCandidateProduct, maxTrialDivisor, verifyWindow);
  }
}
