///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 2026 by the Archy contributors.                             //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package io.github.archy.test;

import io.github.archy.util.Parameters;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestParameters {

    @Test
    public void testDefaults() {
        Parameters parameters = new Parameters();

        assertFalse(parameters.getBoolean(Parameters.VERBOSE));
        assertEquals(0.0, parameters.getDouble(Parameters.DEFAULT_ERROR_TERM), 0.0);
        assertEquals(0.0, parameters.getDouble(Parameters.MISSING_VALUE), 0.0);
        assertEquals(-1, parameters.getInt(Parameters.MAX_PATH_LENGTH));
        assertTrue(parameters.getParametersNames().contains(Parameters.MAX_PATH_LENGTH));
    }

    @Test
    public void testOverrides() {
        Parameters parameters = new Parameters()
                .set(Parameters.VERBOSE, "true")
                .set(Parameters.MAX_PATH_LENGTH, 4);
        Parameters copy = new Parameters(parameters);
        parameters.set(Parameters.MAX_PATH_LENGTH, 5);

        assertTrue(copy.getBoolean(Parameters.VERBOSE));
        assertEquals(4, copy.getInt(Parameters.MAX_PATH_LENGTH));
        assertEquals(5, parameters.getInt(Parameters.MAX_PATH_LENGTH));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParameter() {
        new Parameters().getInt("noSuchParameter");
    }
}
