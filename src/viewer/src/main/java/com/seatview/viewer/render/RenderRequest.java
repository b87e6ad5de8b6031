package com.seatview.viewer.render;

import com.seatview.mapper.camera.CameraPose;

/**
 * One render job.
 *
 * @param venueId venue being rendered
 * @param templateId 3D scene template of the venue
 * @param pose camera viewpoint
 * @param quality output preset
 */
public record RenderRequest(String venueId, String templateId, CameraPose pose, RenderQuality quality) {}
