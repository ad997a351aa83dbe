// ******************************************************************************
//
// Title:       PSX.
// Description: PSX - Protein Data Bank Structure Exchange.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2020.
//
// This file is part of PSX.
//
// PSX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// PSX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// PSX; if not, write to the Free Software Foundation, Inc., 59 Temple
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
// ******************************************************************************
package psx.utilities;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * StringUtils class.
 *
 * @author Michael Schnieders
 */
public class StringUtils {

  /** Width of a PDB record, in columns. */
  public static final int PDB_RECORD_WIDTH = 80;

  private StringUtils() {
    // Prevent instantiation.
  }

  /**
   * Creates a writer for text to a Gzip file.
   *
   * @param file Gzip file to write to.
   * @return A BufferedWriter.
   * @throws java.io.IOException Thrown if creation of the GZip Writer fails.
   */
  public static BufferedWriter createGzipWriter(File file) throws IOException {
    return createGzipWriter(file, StandardCharsets.UTF_8);
  }

  /**
   * Creates a writer for text to a Gzip file.
   *
   * @param file Gzip file to write to.
   * @param cs Character set to use.
   * @return A BufferedWriter.
   * @throws java.io.IOException Thrown if creation of the GZip Writer fails.
   */
  public static BufferedWriter createGzipWriter(File file, Charset cs) throws IOException {
    /*
     * The BufferedWriter buffers the input.
     * The OutputStreamWriter converts the input to bytes.
     * The GZIPOutputStream compresses the bytes.
     * The FileOutputStream writes bytes to a file.
     */
    return new BufferedWriter(
        new OutputStreamWriter(new GZIPOutputStream(new FileOutputStream(file)), cs));
  }

  /**
   * Creates a reader from a Gzip file to text.
   *
   * @param file Gzip file to read from.
   * @return A BufferedReader.
   * @throws java.io.IOException Thrown if creation of the GZip Reader fails.
   */
  public static BufferedReader createGzipReader(File file) throws IOException {
    return createGzipReader(file, StandardCharsets.UTF_8);
  }

  /**
   * Creates a reader from a Gzip file to text.
   *
   * @param file Gzip file to read from.
   * @param cs Character set to use.
   * @return A BufferedReader.
   * @throws java.io.IOException Thrown if creation of the GZip Reader fails.
   */
  public static BufferedReader createGzipReader(File file, Charset cs) throws IOException {
    /*
     * The BufferedReader buffers the input requests, reading a large chunk at a time and caching it.
     * The InputStreamReader converts the input bytes to characters.
     * The GZIPInputStream decompresses incoming input bytes from GZIP to raw bytes.
     * The FileInputStream reads raw bytes from a (gzipped) file.
     */
    return new BufferedReader(
        new InputStreamReader(new GZIPInputStream(new FileInputStream(file)), cs));
  }

  /**
   * padRight
   *
   * @param s a {@link java.lang.String} object.
   * @param n a int.
   * @return a {@link java.lang.String} object.
   */
  public static String padRight(String s, int n) {
    return String.format("%-" + n + "s", s);
  }

  /**
   * Right-pads a record with blanks to the full 80 column PDB width. Longer records are returned
   * unchanged.
   *
   * @param record a PDB record, without its line terminator.
   * @return the padded record.
   */
  public static String padRecord(String record) {
    if (record.length() >= PDB_RECORD_WIDTH) {
      return record;
    }
    return padRight(record, PDB_RECORD_WIDTH);
  }

  /**
   * Removes trailing blanks (only the space character) from a String.
   *
   * @param s a {@link java.lang.String} object.
   * @return the String without trailing spaces.
   */
  public static String trimTrailingBlanks(String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == ' ') {
      end--;
    }
    return s.substring(0, end);
  }
}
