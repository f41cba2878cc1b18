import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shapetea.constraint.ConstraintJson;
import com.shapetea.constraint.ConstraintSet;
import com.shapetea.constraint.ConstraintType;
import com.shapetea.constraint.IdManager;
import com.shapetea.symbolic.ExpNum;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConstraintJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    public void exports_pool_and_index_arrays() throws Exception {
        ConstraintSet cs = ConstraintSet.create(new IdManager());
        ExpNum x = ExpNum.fromSymbol(cs.genSymInt("x", null));
        ExpNum y = ExpNum.fromSymbol(cs.genSymInt("y", null));

        cs = cs.guarantee(cs.genNumCompare(ConstraintType.LESS_THAN_OR_EQUAL, ExpNum.fromConst(0, null), x, null));
        cs = cs.require(cs.genEquality(ConstraintType.EQUAL, x, y, null).withMessage("x must equal y"));
        cs = cs.addIf(cs.genNumCompare(ConstraintType.LESS_THAN, y, ExpNum.fromConst(4, null), null));

        JsonNode root = om.readTree(ConstraintJson.toJson(cs));
        assertEquals(3, root.get("ctrPool").size());
        assertEquals(1, root.get("hardCtr").size());
        assertEquals(1, root.get("softCtr").size());
        assertEquals(1, root.get("pathCtr").size());

        JsonNode soft = root.get("ctrPool").get(root.get("softCtr").get(0).asInt());
        assertEquals("EQUAL", soft.get("type").asText());
        assertTrue(soft.get("message").asText().startsWith("x must equal y"));
        assertTrue(soft.get("source").isNull());
        assertTrue(soft.get("str").asText().contains("x"));
    }

    @Test
    public void empty_set_has_empty_arrays() throws Exception {
        JsonNode root = om.readTree(ConstraintJson.toJson(ConstraintSet.create(new IdManager())));
        assertEquals(0, root.get("ctrPool").size());
        assertTrue(root.get("hardCtr").isArray());
        assertTrue(root.get("softCtr").isArray());
        assertTrue(root.get("pathCtr").isArray());
    }
}
