import com.shapetea.context.Context;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.SVFloat;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.ir.Expr;
import com.shapetea.ir.Statement.Stmt;
import com.shapetea.service.AnalysisResult;
import com.shapetea.service.ShapeTeaService;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.NumRange;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.shapetea.ir.Ir.*;
import static org.junit.jupiter.api.Assertions.*;

public class ShapePluginTest {

    private static Expr.LibCall zeros(long... dims) {
        Expr.LibParam[] params = new Expr.LibParam[dims.length];
        for (int i = 0; i < dims.length; i++) {
            params[i] = param(null, intConst(dims[i]));
        }
        return libCall("zeros", params);
    }

    private static Expr.LibCall op(String name, Expr.ExprNode... args) {
        Expr.LibParam[] params = new Expr.LibParam[args.length];
        for (int i = 0; i < args.length; i++) {
            params[i] = param(null, args[i]);
        }
        return libCall(name, params);
    }

    private static AnalysisResult onTensor(Expr.LibCall tensor, Expr.LibCall call) {
        Stmt entry = let("t", tensor, ret(call));
        return new ShapeTeaService().analyze("main", entry);
    }

    private static List<Double> resultDims(AnalysisResult result) {
        assertEquals(1, result.getSuccess().size(), "expected one live path, failed: " + result.getFailed());
        Context<Object> ctx = result.getSuccess().get(0);
        ShValue tensor = ctx.heap.fetchAddr((ShValue) ctx.retVal);
        assertTrue(tensor instanceof SVObject, "expected a tensor, got " + tensor);
        List<ExpNum> dims = ctx.ctrSet.getCachedShape(((SVObject) tensor).shape());
        assertNotNull(dims, "shape is not constant: " + ((SVObject) tensor).shape());
        List<Double> out = new ArrayList<>();
        for (ExpNum dim : dims) {
            NumRange r = ctx.getCachedRange(dim);
            assertTrue(r != null && r.isConst(), "dimension is not constant: " + dim);
            out.add(r.start);
        }
        return out;
    }

    private static void assertFailsWith(AnalysisResult result, String prefix) {
        assertTrue(result.getSuccess().isEmpty());
        assertEquals(1, result.getFailed().size());
        String reason = result.getFailed().get(0).failed.reason;
        assertTrue(reason.startsWith(prefix), reason);
    }

    @Test
    public void identity_shape_copies_dimensions() {
        assertEquals(Arrays.asList(2.0, 5.0), resultDims(onTensor(zeros(2, 5), op("identityShape", name("t")))));
    }

    @Test
    public void transpose_swaps_axes() {
        AnalysisResult result = onTensor(zeros(2, 3, 4), op("transpose", name("t"), intConst(0), intConst(-1)));
        assertEquals(Arrays.asList(4.0, 3.0, 2.0), resultDims(result));
    }

    @Test
    public void transpose_out_of_range_fails() {
        AnalysisResult result = onTensor(zeros(2, 3, 4), op("transpose", name("t"), intConst(0), intConst(3)));
        assertFailsWith(result, "from 'LibCall.shape.transpose': dimension out of range");
    }

    @Test
    public void unsqueeze_inserts_unit_dimension() {
        assertEquals(Arrays.asList(3.0, 1.0, 4.0),
                resultDims(onTensor(zeros(3, 4), op("unsqueeze", name("t"), intConst(1)))));
        assertEquals(Arrays.asList(3.0, 4.0, 1.0),
                resultDims(onTensor(zeros(3, 4), op("unsqueeze", name("t"), intConst(-1)))));
    }

    @Test
    public void unsqueeze_past_rank_fails() {
        AnalysisResult result = onTensor(zeros(3, 4), op("unsqueeze", name("t"), intConst(5)));
        assertFailsWith(result, "from 'LibCall.shape.unsqueeze': dim must be within rank");
    }

    @Test
    public void flatten_collapses_range_of_axes() {
        assertEquals(Arrays.asList(24.0), resultDims(onTensor(zeros(2, 3, 4), op("flatten", name("t")))));
        assertEquals(Arrays.asList(2.0, 12.0),
                resultDims(onTensor(zeros(2, 3, 4), op("flatten", name("t"), intConst(1)))));
    }

    @Test
    public void flatten_with_reversed_axes_fails() {
        AnalysisResult result = onTensor(zeros(2, 3, 4), op("flatten", name("t"), intConst(2), intConst(1)));
        assertFailsWith(result, "from 'LibCall.shape.flatten'");
    }

    @Test
    public void view_keeps_element_count() {
        assertEquals(Arrays.asList(6.0, 4.0),
                resultDims(onTensor(zeros(2, 3, 4), op("view", name("t"), intConst(6), intConst(4)))));
    }

    @Test
    public void view_infers_wildcard_dimension() {
        Expr.LibCall size = op("genList", intConst(-1), intConst(4));
        assertEquals(Arrays.asList(6.0, 4.0), resultDims(onTensor(zeros(2, 3, 4), op("view", name("t"), size))));
    }

    @Test
    public void view_with_different_element_count_fails() {
        assertFailsWith(onTensor(zeros(2, 3, 4), op("view", name("t"), intConst(5), intConst(5))),
                "from 'LibCall.shape.view': number of elements mismatch");
        assertFailsWith(onTensor(zeros(2, 3, 4), op("view", name("t"), intConst(-1), intConst(5))),
                "from 'LibCall.shape.view': number of elements mismatch");
    }

    @Test
    public void cat_sums_the_joined_axis() {
        Stmt first = let("a", zeros(2, 3), let("b", zeros(4, 3),
                ret(op("cat", op("genList", name("a"), name("b")), intConst(0)))));
        assertEquals(Arrays.asList(6.0, 3.0), resultDims(new ShapeTeaService().analyze("main", first)));

        Stmt last = let("a", zeros(2, 3), let("b", zeros(2, 5),
                ret(op("cat", op("genList", name("a"), name("b")), intConst(-1)))));
        assertEquals(Arrays.asList(2.0, 8.0), resultDims(new ShapeTeaService().analyze("main", last)));
    }

    @Test
    public void cat_with_mismatched_other_axis_fails() {
        Stmt entry = let("a", zeros(2, 3), let("b", zeros(2, 4),
                ret(op("cat", op("genList", name("a"), name("b")), intConst(0)))));
        assertFailsWith(new ShapeTeaService().analyze("main", entry),
                "from 'LibCall.shape.cat': tensor shapes must match");
    }

    @Test
    public void diag_of_vector_and_matrix() {
        assertEquals(Arrays.asList(3.0, 3.0), resultDims(onTensor(zeros(3), op("diag", name("t")))));
        assertEquals(Arrays.asList(3.0), resultDims(onTensor(zeros(3, 5), op("diag", name("t")))));
    }

    @Test
    public void diag_of_rank_three_fails() {
        assertFailsWith(onTensor(zeros(2, 2, 2), op("diag", name("t"))),
                "from 'LibCall.shape.diag': rank must be 1 or 2");
    }

    @Test
    public void item_of_single_element_tensor_is_float() {
        AnalysisResult result = onTensor(zeros(1), op("item", name("t")));
        assertEquals(1, result.getSuccess().size());
        Context<Object> ctx = result.getSuccess().get(0);
        assertTrue(ctx.heap.fetchAddr((ShValue) ctx.retVal) instanceof SVFloat);

        assertFailsWith(onTensor(zeros(2, 3), op("item", name("t"))),
                "from 'LibCall.shape.item': tensor must have exactly one element");
    }
}
