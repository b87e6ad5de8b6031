package com.seatview.viewer.render;

import com.seatview.mapper.camera.CameraPose;
import com.seatview.mapper.camera.CameraRotation;
import com.seatview.mapper.geometry.Point3D;

final class TestPoses {
  private TestPoses() {}

  static RenderRequest request() {
    Point3D position = new Point3D(0.0, -30.0, 5.0);
    Point3D target = new Point3D(0.0, -8.0, 0.0);
    CameraPose pose = new CameraPose(
        "yankee_stadium", "101", position, target, CameraRotation.lookingAt(position, target), 70.0);
    return new RenderRequest("yankee_stadium", "yankee_stadium.blend", pose, RenderQuality.PREVIEW);
  }
}
