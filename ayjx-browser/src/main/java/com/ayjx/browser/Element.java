package com.ayjx.browser;

import com.ayjx.common.infra.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * A DOM node of a {@link Tab}, addressed by its backend node id.
 */
@Slf4j
public class Element {

    private final Tab tab;
    private final long backendNodeId;

    private Element(Tab tab, long backendNodeId) {
        this.tab = tab;
        this.backendNodeId = backendNodeId;
    }

    static Element describe(Tab tab, long nodeId) throws CdpException {
        JsonNode described = tab.sendCmd("DOM.describeNode", Json.object().put("nodeId", nodeId).put("depth", 1));
        JsonNode backendId = described.path("node").path("backendNodeId");
        if (!backendId.isIntegralNumber()) {
            throw new CdpException("Missing backendNodeId");
        }
        return new Element(tab, backendId.asLong());
    }

    public long getBackendNodeId() {
        return backendNodeId;
    }

    /**
     * Capture the element's border box.
     *
     * @return base64-encoded image
     */
    public String screenshot(CaptureOptions options) throws CdpException {
        if (options.getViewport() != null) {
            tab.setViewport(options.getViewport());
        }
        JsonNode border = tab.sendCmd("DOM.getBoxModel", Json.object().put("backendNodeId", backendNodeId))
                .path("model").path("border");
        if (!border.isArray() || border.size() < 8) {
            throw new CdpException("Failed to get box model border");
        }
        double x = border.get(0).asDouble();
        double y = border.get(1).asDouble();
        ClipRegion clip = new ClipRegion(x, y, border.get(2).asDouble() - x, border.get(5).asDouble() - y, 1.0);

        ObjectNode params = Tab.screenshotParams(options);
        params.set("clip", Tab.clipNode(clip));

        boolean transparent = options.isOmitBackground() && options.getFormat() == ImageFormat.PNG;
        if (transparent) {
            ObjectNode color = Json.object();
            color.putObject("color").put("r", 0).put("g", 0).put("b", 0).put("a", 0);
            tab.sendCmd("Emulation.setDefaultBackgroundColorOverride", color);
        }
        tab.activate();
        String data = tab.capture(params);
        if (transparent) {
            try {
                tab.sendCmd("Emulation.setDefaultBackgroundColorOverride", Json.object());
            } catch (CdpException e) {
                log.debug("[cdp] background reset failed: {}", e.getMessage());
            }
        }
        return data;
    }
}
