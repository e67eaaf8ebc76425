/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.io;

import org.json.JSONArray;
import org.json.JSONObject;

import ca.mcgill.cs.syntree.sense.Sense;
import ca.mcgill.cs.syntree.sense.SyntreeAnnotations;

import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;


/**
 * Renders a syntactic tree as nested JSON objects.  Every node has its {@code
 * id}, {@code type}, {@code label}, {@code relation} (absent on the root) and
 * {@code text}; word nodes add {@code token}, {@code lemma} and {@code pos},
 * plus {@code sense} when one was chosen; other nodes list their {@code
 * children}.
 */
public class TreeJsonSerializer {

    public JSONObject toJson(SyntacticTree tree) {
        return toJson(tree.root());
    }

    public JSONObject toJson(SyntacticNode node) {
        JSONObject jo = new JSONObject();
        jo.put("id", node.id());
        jo.put("type", node.type().name());
        jo.put("label", node.label());
        if (node.relation() != null)
            jo.put("relation", node.relation());
        jo.put("text", node.text());
        if (node.isWord()) {
            jo.put("token", node.token().index());
            jo.put("lemma", node.token().lemma());
            jo.put("pos", node.token().pos());
            if (node.isLemmaForm())
                jo.put("lemmaForm", true);
            Sense sense = (node.hasAnnotations())
                ? node.annotations().get(SyntreeAnnotations.SenseAnnotation.class)
                : null;
            if (sense != null) {
                JSONObject so = new JSONObject();
                so.put("id", sense.id());
                so.put("definition", sense.definition());
                so.put("frequency", sense.frequency());
                jo.put("sense", so);
            }
        }
        else {
            JSONArray children = new JSONArray();
            for (SyntacticNode c : node.children())
                children.put(toJson(c));
            jo.put("children", children);
        }
        return jo;
    }

    /**
     * Returns the tree as a single line of JSON.
     */
    public String serialize(SyntacticTree tree) {
        return toJson(tree).toString();
    }
}
