/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectra.io;

import com.twentyn.spectra.compare.ComparisonResult;
import com.twentyn.spectra.compare.SectionComparator;
import com.twentyn.spectra.model.DataMode;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.ExtraInfo;
import com.twentyn.spectra.model.ItemInput;
import com.twentyn.spectra.model.PeakMultiplicity;
import com.twentyn.spectra.model.PeakShape;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.SpectrumParameter;
import com.twentyn.spectra.model.ValueRange;
import com.twentyn.spectra.model.VarDependency;
import com.twentyn.spectra.model.VariableDefinition;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpectrumInterchangeModelTest {
  private static final double DELTA = 1e-9;

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private static SpectrumData makeData() {
    SpectrumData data = new SpectrumData(Arrays.asList(
        new VariableDefinition("x", VarDependency.INDEPENDENT, "Hz", "ppm").setName("shift"),
        VariableDefinition.dependent("y", "arbitrary"),
        VariableDefinition.dependent("d", "arbitrary")));
    data.setParameter(SpectrumParameter.OBSERVE_FREQUENCY, 400.0, "MHz");
    return data;
  }

  private static DataSection addCurve(SpectrumData data) {
    DataSection curve = data.createSection(DataMode.CONTINUOUS);
    curve.setTitle("curve");
    curve.setContinuousVarRange("x", 4000, 0);
    curve.setDefaultVarValue("d", 1.5);
    for (int i = 0; i < 20; i++) {
      curve.appendItem(Collections.singletonMap("y", Math.sin(i / 3.0)));
    }
    return curve;
  }

  private static DataSection addPeaks(SpectrumData data, boolean withExtraInfo) {
    DataSection peaks = data.createSection(Arrays.asList("x", "y"), DataMode.PEAK);
    peaks.setPeakRootValue("y", 0.1);
    peaks.setPeakMatchTolerance(0.01);
    peaks.setDisplayRange("x", new ValueRange(0, 4000));
    peaks.appendItem(ItemInput.of(420.5, 10), withExtraInfo ?
        new ExtraInfo(PeakShape.SHARP, PeakMultiplicity.DOUBLET).addAssignment("H1").setDetail("J", 7.25) : null);
    peaks.appendItem(ItemInput.of(1800.0, Double.NaN), null);
    peaks.appendItem(ItemInput.of(960.25, 3), withExtraInfo ? new ExtraInfo().setShape(PeakShape.BROAD) : null);
    return peaks;
  }

  private static void assertRoundTrip(SpectrumData data) throws Exception {
    String json = SpectrumInterchangeModel.fromSpectrumData(data).writeToJsonString();
    SpectrumData copy = SpectrumInterchangeModel.loadFromJsonString(json).toSpectrumData();
    ComparisonResult result = new SectionComparator().compare(data, copy);
    assertTrue(result.toString(), result.isEqual());
  }

  @Test
  public void testContinuousRoundTrip() throws Exception {
    SpectrumData data = makeData();
    addCurve(data);
    assertRoundTrip(data);
  }

  @Test
  public void testPeakRoundTrip() throws Exception {
    SpectrumData data = makeData();
    addPeaks(data, false);
    assertRoundTrip(data);
  }

  @Test
  public void testPeakRoundTripWithExtraInfo() throws Exception {
    SpectrumData data = makeData();
    addPeaks(data, true);
    assertRoundTrip(data);
  }

  @Test
  public void testSettingsSurviveRoundTrip() throws Exception {
    SpectrumData data = makeData();
    addCurve(data);
    addPeaks(data, true);
    data.setActiveSectionIndex(1);

    File file = tempFolder.newFile("spectrum.json");
    SpectrumInterchangeModel.fromSpectrumData(data).writeToJsonFile(file);
    SpectrumData copy = SpectrumInterchangeModel.loadFromJsonFile(file).toSpectrumData();

    assertEquals(1, copy.getActiveSectionIndex());
    assertEquals("shift", copy.getVariable("x").getName());
    assertEquals("ppm", copy.getVariable("x").getExternalUnit());
    assertEquals(new SpectrumParameter(400.0, "MHz"), copy.getParameter(SpectrumParameter.OBSERVE_FREQUENCY).get());

    DataSection curve = copy.getSectionAt(0);
    assertEquals("curve", curve.getTitle());
    assertEquals(4000.0, curve.getContinuousVarRange("x").getFromValue(), DELTA);
    assertEquals(1.5, curve.getDefaultVarValue("d"), DELTA);
    assertTrue("Omitted values stay omitted", Double.isNaN(curve.getRawItemAt(3)[0]));

    DataSection peaks = copy.getSectionAt(1);
    assertEquals(0.1, peaks.getPeakRootValue("y"), DELTA);
    assertEquals(0.01, peaks.getPeakMatchTolerance(), DELTA);
    assertEquals(new ValueRange(0, 4000), peaks.getDisplayRange("x", false));
    assertEquals(0.1, peaks.getItemAt(1)[1], DELTA);
    assertEquals(7.25, (Double) peaks.getExtraInfoAt(0).getDetail("J"), DELTA);
    assertEquals("Restored peaks can be looked up", 10.0,
        peaks.getDataValueFromIndependent(Collections.singletonMap("x", 420.5), null).get()[1], DELTA);
  }

  @Test
  public void testFileIsWrittenAsUtf8() throws Exception {
    SpectrumData data = new SpectrumData(Arrays.asList(
        VariableDefinition.independent("x", "\u00b5m"),
        VariableDefinition.dependent("y", "\u00c5")));
    DataSection section = data.createSection(DataMode.CONTINUOUS);
    section.appendItem(ItemInput.of(1.0, 2.0));
    section.appendItem(ItemInput.of(2.0, 4.0));

    File file = tempFolder.newFile("units.json");
    SpectrumInterchangeModel.fromSpectrumData(data).writeToJsonFile(file);

    String text = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    assertTrue("Unit symbols are encoded as UTF-8", text.contains("\"\u00b5m\""));
    assertTrue("Unit symbols are encoded as UTF-8", text.contains("\"\u00c5\""));

    SpectrumData copy = SpectrumInterchangeModel.loadFromJsonFile(file).toSpectrumData();
    assertEquals("\u00b5m", copy.getVariable("x").getInternalUnit());
    assertEquals("\u00c5", copy.getVariable("y").getInternalUnit());
    ComparisonResult result = new SectionComparator().compare(data, copy);
    assertTrue(result.toString(), result.isEqual());
  }
}
