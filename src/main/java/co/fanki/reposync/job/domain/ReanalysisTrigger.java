package co.fanki.reposync.job.domain;

/**
 * Fire-and-forget handoff to the component that re-analyzes changed
 * files.
 *
 * <p>Implementations must return quickly; the job does not wait for the
 * analysis to happen.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ReanalysisTrigger {

    /**
     * Hands a sync outcome over to re-analysis.
     *
     * @param request the repository, its new watermark and changed paths
     */
    void trigger(ReanalysisRequest request);

}
