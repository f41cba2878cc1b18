package com.shapetea.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.shapetea.constraint.Constraint;
import com.shapetea.constraint.ExpSimplifier;
import com.shapetea.context.Context;
import com.shapetea.context.ContextSet;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.ObjectLike;
import com.shapetea.context.ShValue.SVFloat;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVObject;
import com.shapetea.context.ShValue.SVSize;
import com.shapetea.debug.Debug;
import com.shapetea.interpreter.LibCallParams;
import com.shapetea.interpreter.LibCallRegistry;
import com.shapetea.ir.CodeSource;
import com.shapetea.symbolic.ExpNum;
import com.shapetea.symbolic.ExpShape;

/**
 * Tensor and Size intrinsics. Tensors are plain objects carrying a shape and a {@code shape}
 * attribute that points to a Size.
 */
public final class ShapePlugin {

    private ShapePlugin() {}

    public static void register(LibCallRegistry registry) {

        // ===================== CONSTRUCTION =====================

        // zeros(shape=<list|tuple|Size>) or zeros(d0, d1, ...)
        registry.register("zeros", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            ShValue shapeArg = params.has("shape") ? params.get("shape") : params.get(0);
            if (shapeArg == null) {
                return ctx.genTensor(ExpShape.fromConst(0, new ArrayList<>(), source), source).toSet();
            }
            ShValue fetched = ctx.heap.fetchAddr(shapeArg);
            if (fetched instanceof ObjectLike) {
                return ctx.parseSize(shapeArg, source).flatMap(c -> {
                    if (c.retVal.error != null) {
                        return c.warnTensorWithMsg("from 'LibCall.shape.zeros': " + c.retVal.error, source);
                    }
                    return c.genTensor(c.retVal.shape, source).toSet();
                });
            }

            List<ExpNum> dims = new ArrayList<>(params.size());
            for (ShValue v : params.values()) {
                ShValue dim = ctx.heap.fetchAddr(v);
                if (!(dim instanceof SVInt)) {
                    return ctx.warnTensorWithMsg("from 'LibCall.shape.zeros': dimension is not an integer: got "
                            + ShValue.typeName(dim), source);
                }
                dims.add(((SVInt) dim).value);
            }
            List<Constraint> nonNeg = new ArrayList<>(dims.size());
            for (ExpNum d : dims) {
                nonNeg.add(ctx.genLte(0, d, source));
            }
            ExpShape shape = ExpShape.fromConst(dims.size(), dims, source);
            return ctx.require(nonNeg, "from 'LibCall.shape.zeros': negative dimension", source)
                    .flatMap(c -> c.genTensor(shape, source).toSet());
        });

        // ===================== OPERATIONS =====================

        registry.register("matmul", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.matmul", params.size(), source);
            }
            ExpShape left = fetchShape(ctx, params.get(0));
            ExpShape right = fetchShape(ctx, params.get(1));
            if (left == null || right == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.matmul': operand is not a tensor", source);
            }
            Debug.get().t(Debug.TAG_LIBCALL, "matmul " + left + " @ " + right);
            return ctx.shMatmul(left, right, source).flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        registry.register("broadcast", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.broadcast", params.size(), source);
            }
            ExpShape left = fetchShape(ctx, params.get(0));
            ExpShape right = fetchShape(ctx, params.get(1));
            if (left == null || right == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.broadcast': operand is not a tensor", source);
            }
            return ctx.shBroadcast(left, right, source).flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        // reduce(tensor, axis): negative axis counts from the end
        registry.register("reduce", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.reduce", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            ShValue axisVal = ctx.heap.fetchAddr(params.get(1));
            if (shape == null || !(axisVal instanceof SVInt)) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.reduce': invalid tensor or axis", source);
            }
            ExpNum rank = ExpShape.getRank(shape);
            ExpNum axis = ((SVInt) axisVal).value;
            if (axis.isConst() && axis.constValue() < 0) {
                axis = ExpSimplifier.simplifyNum(ctx.ctrSet, ExpNum.bop(ExpNum.BopType.ADD, rank, axis, source));
            }
            ExpNum finalAxis = axis;
            return ctx.require(ctx.genAnd(ctx.genLte(0, finalAxis, source), ctx.genLt(finalAxis, rank, source), source),
                            "from 'LibCall.shape.reduce': axis out of range", source)
                    .flatMap(c -> c.shReduce(shape, finalAxis, source))
                    .flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        // repeat(tensor, axis, count): inserts a dimension of size count at axis
        registry.register("repeat", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 3) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.repeat", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            ShValue axisVal = ctx.heap.fetchAddr(params.get(1));
            ShValue countVal = ctx.heap.fetchAddr(params.get(2));
            if (shape == null || !(axisVal instanceof SVInt) || !(countVal instanceof SVInt)) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.repeat': invalid tensor, axis or count", source);
            }
            ExpNum rank = ExpShape.getRank(shape);
            ExpNum axis = ((SVInt) axisVal).value;
            ExpNum count = ((SVInt) countVal).value;

            ContextSet.Branches<LibCallParams> branches = ctx.ifThenElse(ctx.genLte(0, axis, source), source);
            ContextSet<ExpShape> positive = branches.thenSet.flatMap(c -> c.shRepeat(shape, axis, count, source));
            ExpNum shifted = ExpNum.bop(ExpNum.BopType.ADD, ExpNum.bop(ExpNum.BopType.ADD, rank, axis, source), 1,
                    source);
            ContextSet<ExpShape> negative = branches.elseSet.flatMap(c -> c.shRepeat(shape,
                    ExpSimplifier.simplifyNum(c.ctrSet, shifted), count, source));
            return positive.join(negative).flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        registry.register("identityShape", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 1) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.identityShape", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            if (shape == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.identityShape': not a tensor", source);
            }
            return ctx.genTensor(shape, source).toSet();
        });

        // transpose(tensor, dim0, dim1): dims may count from the end
        registry.register("transpose", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 3) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.transpose", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            if (shape == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.transpose': not a tensor", source);
            }
            ShValue dim0Val = ctx.heap.fetchAddr(params.get(1));
            ShValue dim1Val = ctx.heap.fetchAddr(params.get(2));
            if (!(dim0Val instanceof SVInt)) {
                return ctx.failToSet("from 'LibCall.shape.transpose': cannot infer dim0 as integer", source);
            }
            if (!(dim1Val instanceof SVInt)) {
                return ctx.failToSet("from 'LibCall.shape.transpose': cannot infer dim1 as integer", source);
            }
            ExpNum dim0 = ((SVInt) dim0Val).value;
            ExpNum dim1 = ((SVInt) dim1Val).value;
            ExpNum rank = ExpShape.getRank(shape);
            ExpNum negRank = ExpNum.uop(ExpNum.UopType.NEG, rank, source);

            List<Constraint> inRange = new ArrayList<>();
            inRange.add(ctx.genLte(negRank, dim0, source));
            inRange.add(ctx.genLt(dim0, rank, source));
            inRange.add(ctx.genLte(negRank, dim1, source));
            inRange.add(ctx.genLt(dim1, rank, source));

            return ctx.require(inRange, "from 'LibCall.shape.transpose': dimension out of range", source)
                    .flatMap(c -> c.normalizeAxis(dim0, rank, source))
                    .flatMap(c -> {
                        ExpNum axis0 = c.retVal;
                        return c.normalizeAxis(dim1, rank, source)
                                .flatMap(c1 -> c1.shTranspose(shape, axis0, c1.retVal, source));
                    })
                    .flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        // unsqueeze(tensor, dim): a negative dim counts from past the last axis
        registry.register("unsqueeze", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.unsqueeze", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            ShValue dimVal = ctx.heap.fetchAddr(params.get(1));
            if (shape == null || !(dimVal instanceof SVInt)) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.unsqueeze': invalid tensor or dim", source);
            }
            ExpNum dim = ((SVInt) dimVal).value;
            ExpNum extended = ExpNum.bop(ExpNum.BopType.ADD, ExpShape.getRank(shape), 1, source);
            return ctx.normalizeAxis(dim, extended, source)
                    .flatMap(c -> c.shUnsqueeze(shape, c.retVal, source))
                    .flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        // flatten(tensor, start_dim=0, end_dim=-1)
        registry.register("flatten", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() < 1 || params.size() > 3) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.flatten", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            if (shape == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.flatten': not a tensor", source);
            }
            ShValue startVal = params.has("start_dim") ? params.get("start_dim") : params.get(1);
            ShValue endVal = params.has("end_dim") ? params.get("end_dim") : params.get(2);
            ExpNum start = startVal == null ? ExpNum.fromConst(0, source) : intArg(ctx, startVal);
            ExpNum end = endVal == null ? ExpNum.fromConst(-1, source) : intArg(ctx, endVal);
            if (start == null || end == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.flatten': dims must be integers", source);
            }
            ExpNum rank = ExpShape.getRank(shape);
            return ctx.normalizeAxis(start, rank, source)
                    .flatMap(c -> {
                        ExpNum startAxis = c.retVal;
                        return c.normalizeAxis(end, rank, source)
                                .flatMap(c1 -> c1.shFlatten(shape, startAxis, c1.retVal, source));
                    })
                    .flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        // view(tensor, size) or view(tensor, d0, d1, ...); at most one dim may be -1
        registry.register("view", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() < 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.view", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            if (shape == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.view': not a tensor", source);
            }

            List<ExpNum> dims;
            ShValue first = ctx.heap.fetchAddr(params.get(1));
            if (params.size() > 2 || first instanceof SVInt) {
                dims = new ArrayList<>();
                for (ShValue v : params.dropFirst().values()) {
                    ExpNum dim = intArg(ctx, v);
                    if (dim == null) {
                        return ctx.warnTensorWithMsg("from 'LibCall.shape.view': dimension is not an integer", source);
                    }
                    dims.add(dim);
                }
            } else if (first instanceof SVSize) {
                return ctx.shView(shape, ((SVSize) first).shape, source)
                        .flatMap(c -> c.genTensor(c.retVal, source).toSet());
            } else {
                dims = constDims(ctx, first);
                if (dims == null) {
                    return ctx.warnTensorWithMsg("from 'LibCall.shape.view': size must have constant rank", source);
                }
            }

            int wildcard = -1;
            for (int i = 0; i < dims.size(); i++) {
                ExpNum dim = dims.get(i);
                if (dim.isConst() && dim.constValue() == -1) {
                    if (wildcard >= 0) {
                        return ctx.failToSet("from 'LibCall.shape.view': only one dimension can be inferred", source);
                    }
                    wildcard = i;
                }
            }
            if (wildcard < 0) {
                return ctx.shView(shape, ExpShape.fromConst(dims.size(), dims, source), source)
                        .flatMap(c -> c.genTensor(c.retVal, source).toSet());
            }

            List<ExpNum> known = new ArrayList<>(dims);
            known.remove(wildcard);
            ExpNum selfNumel = ExpNum.numel(shape, source);
            ExpNum knownNumel = ExpNum.numel(ExpShape.fromConst(known.size(), known, source), source);
            List<ExpNum> inferred = new ArrayList<>(dims);
            inferred.set(wildcard, ExpSimplifier.simplifyNum(ctx.ctrSet,
                    ExpNum.bop(ExpNum.BopType.FLOORDIV, selfNumel, knownNumel, source)));
            ExpShape target = ExpShape.fromConst(inferred.size(), inferred, source);
            Constraint divisible = ctx.genEq(ExpNum.bop(ExpNum.BopType.MOD, selfNumel, knownNumel, source), 0, source);
            return ctx.require(divisible, "from 'LibCall.shape.view': number of elements mismatch", source)
                    .flatMap(c -> c.genTensor(ExpSimplifier.simplifyShape(c.ctrSet, target), source).toSet());
        });

        // cat(tensors, dim): tensors is a list or tuple of constant length
        registry.register("cat", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.cat", params.size(), source);
            }
            ShValue tensors = ctx.heap.fetchAddr(params.get(0));
            ShValue dimVal = ctx.heap.fetchAddr(params.get(1));
            if (!(tensors instanceof ObjectLike)) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.cat': tensors is not iterable", source);
            }
            if (!(dimVal instanceof SVInt)) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.cat': dim is not an integer", source);
            }
            ShValue lengthVal = ctx.heap.fetchAddr(((ObjectLike) tensors).getAttr("$length"));
            if (!(lengthVal instanceof SVInt) || !((SVInt) lengthVal).isConst() || ((SVInt) lengthVal).constValue() < 1) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.cat': length of tensors is unknown, cannot iterate.",
                        source);
            }
            int length = (int) ((SVInt) lengthVal).constValue();
            List<ExpShape> shapes = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                ExpShape s = fetchShape(ctx, ((ObjectLike) tensors).getIndice(i));
                if (s == null) {
                    return ctx.warnTensorWithMsg("from 'LibCall.shape.cat': item " + i + " is not a tensor", source);
                }
                shapes.add(s);
            }
            ExpNum dim = ((SVInt) dimVal).value;
            return ctx.normalizeAxis(dim, ExpShape.getRank(shapes.get(0)), source)
                    .flatMap(c -> c.shCat(shapes, c.retVal, source))
                    .flatMap(c -> c.genTensor(c.retVal, source).toSet());
        });

        // diag(tensor, diagonal=0): rank 1 builds a square matrix, rank 2 extracts a diagonal
        registry.register("diag", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() < 1 || params.size() > 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.diag", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            ExpNum diagonal = params.size() == 2 ? intArg(ctx, params.get(1)) : ExpNum.fromConst(0, source);
            if (shape == null || diagonal == null) {
                return ctx.warnTensorWithMsg("from 'LibCall.shape.diag': invalid tensor or diagonal", source);
            }
            ExpNum rank = ExpShape.getRank(shape);
            Constraint rankOne = ctx.genEq(rank, 1, source);
            return ctx.require(ctx.genOr(rankOne, ctx.genEq(rank, 2, source), source),
                            "from 'LibCall.shape.diag': rank must be 1 or 2", source)
                    .flatMap(c -> {
                        ContextSet.Branches<LibCallParams> branches = c.ifThenElse(rankOne, source);
                        ContextSet<ShValue> square = branches.thenSet.flatMap(c1 -> {
                            ExpNum side = ExpNum.bop(ExpNum.BopType.ADD, ExpNum.index(shape, 0, source),
                                    ExpNum.uop(ExpNum.UopType.ABS, diagonal, source), source);
                            side = ExpSimplifier.simplifyNum(c1.ctrSet, side);
                            List<ExpNum> dims = new ArrayList<>();
                            dims.add(side);
                            dims.add(side);
                            return c1.genTensor(ExpShape.fromConst(2, dims, source), source).toSet();
                        });
                        ContextSet<ShValue> line = branches.elseSet.flatMap(c1 -> {
                            ExpNum rows = ExpNum.index(shape, 0, source);
                            ExpNum cols = ExpNum.index(shape, 1, source);
                            List<Constraint> bounds = new ArrayList<>();
                            bounds.add(c1.genLte(ExpNum.uop(ExpNum.UopType.NEG, rows, source), diagonal, source));
                            bounds.add(c1.genLte(diagonal, cols, source));
                            List<ExpNum> candidates = new ArrayList<>();
                            candidates.add(rows);
                            candidates.add(cols);
                            candidates.add(ExpNum.bop(ExpNum.BopType.ADD, rows, diagonal, source));
                            candidates.add(ExpNum.bop(ExpNum.BopType.SUB, cols, diagonal, source));
                            List<ExpNum> dims = new ArrayList<>();
                            dims.add(ExpNum.min(candidates, source));
                            return c1.require(bounds, "from 'LibCall.shape.diag': diagonal must be gte -d1 and lte d2",
                                            source)
                                    .flatMap(c2 -> c2.genTensor(ExpSimplifier.simplifyShape(c2.ctrSet,
                                            ExpShape.fromConst(1, dims, source)), source).toSet());
                        });
                        return square.join(line);
                    });
        });

        // item(tensor): scalar value of a one-element tensor
        registry.register("item", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 1) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.item", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            if (shape == null) {
                return ctx.warnWithMsg("from 'LibCall.shape.item': not a tensor", source).toSet();
            }
            Constraint single = ctx.genOr(ctx.genEq(ExpShape.getRank(shape), 0, source),
                    ctx.genEq(ExpNum.numel(shape, source), 1, source), source);
            return ctx.require(single, "from 'LibCall.shape.item': tensor must have exactly one element", source)
                    .map(c -> c.setRetVal((ShValue) SVFloat.of(
                            ExpNum.fromSymbol(c.genSymFloat("tensorItem", source)), source)));
        });

        // ===================== SIZE =====================

        registry.register("size_getitem", (interp, ctx, source) -> {
            LibCallParams params = ctx.retVal;
            if (params.size() != 2) {
                return BuiltinsPlugin.argCountWarning(ctx, "shape.size_getitem", params.size(), source);
            }
            ExpShape shape = fetchShape(ctx, params.get(0));
            ShValue idxVal = ctx.heap.fetchAddr(params.get(1));
            if (shape == null || !(idxVal instanceof SVInt)) {
                return ctx.warnWithMsg("from 'LibCall.shape.size_getitem': invalid size or index", source).toSet();
            }
            ExpNum rank = ExpShape.getRank(shape);
            ExpNum idx = ((SVInt) idxVal).value;
            if (idx.isConst() && idx.constValue() < 0) {
                idx = ExpNum.bop(ExpNum.BopType.ADD, rank, idx, source);
            }
            ExpNum finalIdx = ExpSimplifier.simplifyNum(ctx.ctrSet, idx);
            return ctx.require(ctx.genAnd(ctx.genLte(0, finalIdx, source), ctx.genLt(finalIdx, rank, source), source),
                            "from 'LibCall.shape.size_getitem': index out of range", source)
                    .map(c -> c.setRetVal((ShValue) SVInt.of(
                            ExpSimplifier.simplifyNum(c.ctrSet, ExpNum.index(shape, finalIdx, source)), source)));
        });

        registry.register("size_len", (interp, ctx, source) -> {
            ExpShape shape = fetchShape(ctx, ctx.retVal.get(0));
            if (shape == null) {
                return ctx.warnWithMsg("from 'LibCall.shape.size_len': not a size", source).toSet();
            }
            ExpNum rank = ExpSimplifier.simplifyNum(ctx.ctrSet, ExpShape.getRank(shape));
            return ctx.toSetWith((ShValue) SVInt.of(rank, source));
        });

        // shape(tensor): Size object describing the tensor
        registry.register("shape", (interp, ctx, source) -> {
            ShValue tensorAddr = ctx.retVal.get(0);
            ShValue tensor = ctx.heap.fetchAddr(tensorAddr);
            if (tensor instanceof SVSize) {
                return ctx.toSetWith(tensorAddr);
            }
            if (tensor instanceof ObjectLike) {
                ShValue sizeAddr = ((ObjectLike) tensor).getAttr("shape");
                if (sizeAddr != null && ctx.heap.fetchAddr(sizeAddr) instanceof SVSize) {
                    return ctx.toSetWith(sizeAddr);
                }
            }
            ExpShape shape = fetchShape(ctx, tensorAddr);
            if (shape == null) {
                return ctx.warnSizeWithMsg("from 'LibCall.shape.shape': not a tensor", source).toSet();
            }
            return ctx.genSize(shape, source).toSet();
        });
    }

    private static ExpNum intArg(Context<?> ctx, ShValue value) {
        ShValue v = ctx.heap.fetchAddr(value);
        return v instanceof SVInt ? ((SVInt) v).value : null;
    }

    /** Dimensions listed by a list or tuple of constant length. Null when any is missing. */
    private static List<ExpNum> constDims(Context<?> ctx, ShValue iterable) {
        if (!(iterable instanceof SVObject)) return null;
        SVObject obj = (SVObject) iterable;
        ShValue length = ctx.heap.fetchAddr(obj.getAttr("$length"));
        if (!(length instanceof SVInt) || !((SVInt) length).isConst()) return null;
        Map<Integer, ExpNum> indexed = obj.extractIndexedNumber(ctx.heap);
        int rank = (int) ((SVInt) length).constValue();
        List<ExpNum> dims = new ArrayList<>(rank);
        for (int i = 0; i < rank; i++) {
            ExpNum dim = indexed.get(i);
            if (dim == null) return null;
            dims.add(dim);
        }
        return dims;
    }

    /**
     * Shape carried by a Size, by a tensor object, or by an object whose {@code shape}
     * attribute is a Size. Null when none applies.
     */
    static ExpShape fetchShape(Context<?> ctx, ShValue value) {
        if (value == null) return null;
        ShValue fetched = ctx.heap.fetchAddr(value);
        if (fetched instanceof SVSize) {
            return ((SVSize) fetched).shape;
        }
        if (fetched instanceof SVObject) {
            SVObject obj = (SVObject) fetched;
            if (obj.shape() != null) return obj.shape();
            ShValue size = ctx.heap.fetchAddr(obj.getAttr("shape"));
            if (size instanceof SVSize) return ((SVSize) size).shape;
        }
        return null;
    }
}
