// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * JSON-RPC 2.0 request envelope.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, String id) {}
