/**
 * Host Ports
 * =============================================================================
 *
 * These interfaces are the boundary between the export core and the host
 * application that owns documents, dialogs, preferences and document metadata.
 *
 * <h2>Why these ports exist</h2>
 * The export core must not depend on the shape of the host's document model or
 * UI toolkit. Everything above this package sees only:
 * <ul>
 *   <li>narrow read-only views of documents and layers</li>
 *   <li>string-keyed preferences</li>
 *   <li>a folder chooser and input-policy switches</li>
 *   <li>an atomic batch write of JSON metadata blobs</li>
 *   <li>the feature flag that starts the rendering worker</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Return futures rather than block on UI or I/O</li>
 *   <li>Report failures by completing futures exceptionally</li>
 *   <li>Not call back into the export core</li>
 * </ul>
 */
package com.questrail.assetexport.host;
