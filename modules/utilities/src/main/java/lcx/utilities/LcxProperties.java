// ******************************************************************************
//
// Title:       Lattice Correlation X.
// Description: Lattice Correlation X - Momentum-Space Correlation Analysis.
// Copyright:   Copyright (c) Lattice Correlation X Developers 2026.
//              Portions Copyright (c) Michael J. Schnieders 2001-2023.
//
// This file is part of Lattice Correlation X.
//
// Lattice Correlation X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Lattice Correlation X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Lattice Correlation X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
package lcx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The LcxProperties class assembles the layered configuration used by the correlation engine.
 *
 * @author Lattice Correlation X Developers
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class LcxProperties {

  private static final Logger logger = Logger.getLogger(LcxProperties.class.getName());

  /** Name of the environment variable that points to a system wide property file. */
  public static final String LCX_PROPERTIES = "LCX_PROPERTIES";

  /** Tolerance applied to Rodrigues matrix entries before they are rounded to integers. */
  public static final String ROTATION_TOLERANCE = "lcx.rotation.tolerance";
  /** First real-space distance of a default inverse Fourier projection. */
  public static final String ANTIFOURIER_XMIN = "lcx.antifourier.xmin";
  /** Exclusive upper real-space distance of a default inverse Fourier projection. */
  public static final String ANTIFOURIER_XMAX = "lcx.antifourier.xmax";
  /** Lattice direction (0, 1 or 2) of a default inverse Fourier projection. */
  public static final String ANTIFOURIER_AXIS = "lcx.antifourier.axis";
  /** Reject a path whose inferred grid size disagrees with the authoritative one. */
  public static final String STRICT_GRID_SIZE = "lcx.path.strict-grid-size";

  private LcxProperties() {
    // Prevent instantiation.
  }

  /**
   * Load properties without a dataset specific file.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Dataset specific properties (for example run42.properties next to run42.hdf5)
   * <p>
   * 3.) User specific properties (~/.lcx/lcx.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable LCX_PROPERTIES)
   *
   * @param file The dataset file, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Dataset specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File datasetPropFile = new File(basename + ".properties");
      if (datasetPropFile.exists() && datasetPropFile.canRead()) {
        addPropertyFile(properties, datasetPropFile, "Dataset properties");
      }
    }

    // User specific options are 3rd.
    File userPropFile = new File(
        System.getProperty("user.home") + File.separator + ".lcx" + File.separator
            + "lcx.properties");
    if (userPropFile.exists() && userPropFile.canRead()) {
      addPropertyFile(properties, userPropFile, "LCX user property file");
    }

    // System wide options are last.
    String filename = System.getenv(LCX_PROPERTIES);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        addPropertyFile(properties, systemPropFile,
            "Environment variable " + LCX_PROPERTIES);
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys("lcx");
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  private static void addPropertyFile(CompositeConfiguration properties, File propFile,
      String description) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(description + " (" + propFile.getPath() + ").");
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.WARNING, " Error loading {0}.", propFile.getPath());
    }
  }
}
