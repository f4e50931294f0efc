package org.waabox.rolemon.source;

/**
 * Fetches the role membership that the cluster manager assigns to a node.
 *
 * <p>Implementations talk to the cluster manager over an authenticated
 * channel. Every call must be bounded in time so a slow cluster manager
 * cannot stall the reconciliation loop.
 *
 * <p>A failed fetch never changes anything on the node: the loop keeps its
 * last applied state and retries with backoff.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RoleSource {

  /**
   * Fetches the current roles of the given node.
   *
   * @param nodeId the short hostname of the node, never null
   *
   * @return a fresh snapshot of the node roles, never null
   *
   * @throws AuthException if the client credentials are missing, invalid or
   *                       rejected
   * @throws NetworkException if the cluster manager could not be reached or
   *                          answered with an unexpected status
   * @throws ParseException if the answer could not be understood or did not
   *                        list the node
   */
  RoleSnapshot fetch(String nodeId) throws RoleSourceException;
}
