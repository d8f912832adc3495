/**
 * Resource-level client of the orchestration service.
 *
 * <p>{@link express.mvp.conduit.client.OrchestratorClient} exposes tasks, agents, DAGs and
 * approvals on top of the retrying request executor, plus helpers that wait for remote work to
 * finish by polling or through the event stream.
 */
package express.mvp.conduit.client;
