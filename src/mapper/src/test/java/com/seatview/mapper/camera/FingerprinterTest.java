package com.seatview.mapper.camera;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.seatview.mapper.TestVenues;
import com.seatview.mapper.geometry.GeometryEngine;
import com.seatview.mapper.geometry.Point2D;
import com.seatview.mapper.geometry.Point3D;
import com.seatview.mapper.venue.Section;
import com.seatview.mapper.venue.VenueModel;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FingerprinterTest {
  private final Fingerprinter fingerprinter = new Fingerprinter();

  private static CameraPose pose(String sectionId, double x, double y, double z, double fov) {
    Point3D position = new Point3D(x, y, z);
    return new CameraPose("yankee_stadium", sectionId, position, Point3D.ORIGIN,
        CameraRotation.lookingAt(position, Point3D.ORIGIN), fov);
  }

  @Test
  void samePoseAlwaysYieldsSameFingerprint() {
    Fingerprint first = fingerprinter.fingerprint(pose("101", 1.0, -30.0, 5.0, 70.0), "yankee_stadium.blend");
    Fingerprint second = new Fingerprinter().fingerprint(pose("101", 1.0, -30.0, 5.0, 70.0), "yankee_stadium.blend");

    assertThat(first).isEqualTo(second);
    assertThat(first.value()).hasSize(64).matches("[0-9a-f]+");
    assertThat(first.shortValue()).hasSize(12);
  }

  @Test
  void posesWithinOnePrecisionStepShareFingerprint() {
    Fingerprint a = fingerprinter.fingerprint(pose("101", 1.01, -30.02, 5.0, 70.1), "t");
    Fingerprint b = fingerprinter.fingerprint(pose("101", 0.99, -29.98, 5.0, 69.9), "t");

    assertThat(a).isEqualTo(b);
  }

  @Test
  void differentSectionsNeverCollide() {
    VenueModel yankee = TestVenues.yankeeStadium();
    CoordinateMapper mapper = new CoordinateMapper();
    Set<Fingerprint> seen = new HashSet<>();

    for (Section section : yankee.sections()) {
      CameraPose centroidPose = mapper.pose(centroidClick(section), yankee);
      assertThat(seen.add(fingerprinter.fingerprint(centroidPose, yankee.templateId()))).isTrue();
    }

    // Identical geometry under another section id is still a distinct render.
    CameraPose base = pose("101", 0.0, -30.0, 5.0, 70.0);
    CameraPose other = pose("102", 0.0, -30.0, 5.0, 70.0);
    assertThat(fingerprinter.fingerprint(base, "t")).isNotEqualTo(fingerprinter.fingerprint(other, "t"));
  }

  @Test
  void templateAndVariantArePartOfTheKey() {
    CameraPose pose = pose("101", 0.0, -30.0, 5.0, 70.0);

    assertThat(fingerprinter.fingerprint(pose, "a.blend")).isNotEqualTo(fingerprinter.fingerprint(pose, "b.blend"));
    assertThat(fingerprinter.fingerprint(pose, "a.blend", "preview"))
        .isNotEqualTo(fingerprinter.fingerprint(pose, "a.blend", "full"));
  }

  @Test
  void canonicalKeyUsesQuantizedSteps() {
    String key = fingerprinter.canonicalKey(pose("101", 1.2, -30.0, 5.0, 70.4), "t.blend", "preview");

    assertThat(key).isEqualTo("v1|yankee_stadium|t.blend|preview|101|2,-60,10|0,0,0|70");
    assertThat(Fingerprinter.quantize(-0.26, 0.5)).isEqualTo(-1L);
  }

  @Test
  void rejectsNonPositivePrecision() {
    assertThatThrownBy(() -> new Fingerprinter(0.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
  }

  private static ClickPoint centroidClick(Section section) {
    Point2D centroid = GeometryEngine.centroid(section.polygon());
    return new ClickPoint(centroid.x(), centroid.y());
  }
}
