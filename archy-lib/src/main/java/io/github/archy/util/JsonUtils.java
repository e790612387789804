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

package io.github.archy.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.archy.graph.CausalGraph;
import io.github.archy.graph.Graph;
import io.github.archy.graph.GraphUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts graphs to and from the <code>{"nodes": [..], "edges": [[parent, child], ..]}</code> JSON form
 * used to pipe graphs between processes.
 */
public class JsonUtils {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static CausalGraph parseJSONObjectToCausalGraph(String json) {
        try {
            return parseJSONObjectToCausalGraph(new JSONObject(json));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed graph JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Accepts either the bare graph object or one wrapped as <code>{"graph": {...}}</code>.
     */
    public static CausalGraph parseJSONObjectToCausalGraph(JSONObject jObj) {
        if (!jObj.isNull("graph")) {
            return parseJSONObjectToCausalGraph(jObj.getJSONObject("graph"));
        }

        Map<String, Object> dict = new LinkedHashMap<>();

        try {
            dict.put("nodes", jObj.isNull("nodes") ? new ArrayList<>() : parseJSONArrayToNodes(jObj.getJSONArray("nodes")));
            dict.put("edges", jObj.isNull("edges") ? new ArrayList<>() : parseJSONArrayToEdges(jObj.getJSONArray("edges")));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed graph JSON: " + e.getMessage(), e);
        }

        return CausalGraph.fromDict(dict);
    }

    public static List<String> parseJSONArrayToNodes(JSONArray jArray) {
        List<String> nodes = new ArrayList<>();

        for (int i = 0; i < jArray.length(); i++) {
            nodes.add(jArray.getString(i));
        }

        return nodes;
    }

    public static List<List<String>> parseJSONArrayToEdges(JSONArray jArray) {
        List<List<String>> edges = new ArrayList<>();

        for (int i = 0; i < jArray.length(); i++) {
            JSONArray pair = jArray.getJSONArray(i);

            if (pair.length() != 2) {
                throw new IllegalArgumentException("Edge must be a [parent, child] pair: " + pair);
            }

            List<String> edge = new ArrayList<>();
            edge.add(pair.getString(0));
            edge.add(pair.getString(1));
            edges.add(edge);
        }

        return edges;
    }

    /**
     * Works for any graph view, including intervened graphs.
     */
    public static String graphToJson(Graph graph) {
        return GSON.toJson(GraphUtils.toDict(graph));
    }
}
