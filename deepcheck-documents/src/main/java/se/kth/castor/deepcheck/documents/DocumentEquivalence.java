package se.kth.castor.deepcheck.documents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.kth.castor.deepcheck.compare.DeepEquality;
import se.kth.castor.deepcheck.documents.MalformedDocumentException.Side;

/**
 * Compares two serialized documents by their content. Formatting, key order and the spelling of
 * numbers do not matter.
 */
public abstract class DocumentEquivalence {

  private final ObjectMapper objectMapper;

  protected DocumentEquivalence(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses both documents and compares their content.
   *
   * @param expected the expected document
   * @param actual the actual document
   * @return true if both documents carry the same data
   * @throws MalformedDocumentException if either document can not be parsed
   */
  public boolean equivalent(String expected, String actual) throws MalformedDocumentException {
    Object expectedValue = parse(Side.EXPECTED, expected);
    Object actualValue = parse(Side.ACTUAL, actual);
    return DeepEquality.equal(expectedValue, actualValue);
  }

  /**
   * Parses a document into plain values: maps, lists, strings, booleans, {@code null} and
   * {@link Double}s for every number.
   *
   * @param side which side of the comparison the document is on
   * @param document the document text
   * @return the plain value
   * @throws MalformedDocumentException if the document can not be parsed
   */
  Object parse(Side side, String document) throws MalformedDocumentException {
    JsonNode tree;
    try {
      tree = objectMapper.readTree(document);
    } catch (JsonProcessingException e) {
      throw new MalformedDocumentException(side, document, e);
    }
    if ((tree == null || tree.isMissingNode()) && !acceptsEmptyDocument()) {
      throw new MalformedDocumentException(side, document, null);
    }
    return normalize(tree);
  }

  /**
   * @return whether a document without any value stands for {@code null}
   */
  protected abstract boolean acceptsEmptyDocument();

  private static Object normalize(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isObject()) {
      Map<String, Object> object = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        object.put(field.getKey(), normalize(field.getValue()));
      }
      return object;
    }
    if (node.isArray()) {
      List<Object> array = new ArrayList<>();
      for (JsonNode element : node) {
        array.add(normalize(element));
      }
      return array;
    }
    if (node.isNumber()) {
      // a single number type, like JSON itself
      return node.doubleValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    return node.asText();
  }
}
