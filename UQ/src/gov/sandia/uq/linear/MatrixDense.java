/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/
package gov.sandia.uq.linear;

import gov.sandia.uq.language.EvaluationException;
import gov.sandia.uq.language.type.Matrix;

/**
    Matrix with a single block of storage and strided access pattern.
    Strided access allows us to wrap subregions (such as single columns or rows) and transposes
    around the same block of memory.
    Besides serving as the array kind of the coercion tower, this class does the 2x2 Jacobian
    and covariance arithmetic of the complex uncertainty graph.
**/
public class MatrixDense extends Matrix
{
    protected double[] data;  // stored in column-major order
    protected int      offset;
    protected int      rows;
    protected int      columns;
    protected int      strideR;  // elements to skip to reach next row at current column
    protected int      strideC;  // elements to skip to reach next column at current row

    public MatrixDense (int rows, int columns)
    {
        this (rows, columns, 0);
    }

    public MatrixDense (int rows, int columns, double initialValue)
    {
        this.rows    = rows;
        this.columns = columns;
        data         = new double[rows * columns];
        strideR      = 1;
        strideC      = rows;

        if (initialValue == 0) return;
        for (int i = 0; i < data.length; i++) data[i] = initialValue;
    }

    public MatrixDense (Matrix A)
    {
        this (A.rows (), A.columns ());
        int i = 0;
        for (int c = 0; c < columns; c++)
        {
            for (int r = 0; r < rows; r++)
            {
                data[i++] = A.get (r, c);
            }
        }
    }

    /**
        Wraps the given array as a column vector. The array is copied.
    **/
    public MatrixDense (double[] data)
    {
        this (data.clone (), 0, data.length, 1, 1, data.length);
    }

    /**
        Builds a matrix from row-major nested arrays. All rows must have the same length.
    **/
    public MatrixDense (double[][] values) throws EvaluationException
    {
        this (values.length, values.length == 0 ? 0 : values[0].length);
        for (int r = 0; r < rows; r++)
        {
            if (values[r].length != columns) throw new EvaluationException ("Ragged rows in matrix literal");
            for (int c = 0; c < columns; c++) set (r, c, values[r][c]);
        }
    }

    public MatrixDense (double[] data, int offset, int rows, int columns, int strideR, int strideC)
    {
        this.data    = data;
        this.offset  = offset;
        this.rows    = rows;
        this.columns = columns;
        this.strideR = strideR;
        this.strideC = strideC;
    }

    public int rows ()
    {
        return rows;
    }

    public int columns ()
    {
        return columns;
    }

    public double get (int row, int column)
    {
        return data[offset + row * strideR + column * strideC];
    }

    public double get (int row)
    {
        return data[offset + row * strideR];
    }

    public MatrixDense getColumn (int column)
    {
        return new MatrixDense (data, offset + column * strideC, rows, 1, strideR, strideC);
    }

    public MatrixDense getRow (int row)
    {
        return new MatrixDense (data, offset + row * strideR, 1, columns, strideR, strideC);
    }

    /**
        Shares storage with this matrix.
    **/
    public MatrixDense transpose ()
    {
        return new MatrixDense (data, offset, columns, rows, strideC, strideR);
    }

    public void set (int row, int column, double a)
    {
        data[offset + row * strideR + column * strideC] = a;
    }

    public void set (int row, double a)
    {
        data[offset + row * strideR] = a;
    }

    public MatrixDense clear (double initialValue)
    {
        return new MatrixDense (rows, columns, initialValue);
    }

    /**
        @return A new matrix of the same shape, with diagonal elements set to 1 and off-diagonals set to zero.
    **/
    public MatrixDense identity ()
    {
        MatrixDense result = new MatrixDense (rows, columns);
        int h = Math.min (rows, columns);
        for (int r = 0; r < h; r++) result.data[r * (rows + 1)] = 1;
        return result;
    }

    public static MatrixDense identity (int size)
    {
        return new MatrixDense (size, size).identity ();
    }

    public MatrixDense visit (Visitor visitor)
    {
        MatrixDense result = new MatrixDense (rows, columns);
        int step = strideC - rows * strideR;
        int i = offset;
        int r = 0;
        int end = rows * columns;
        while (r < end)
        {
            int columnEnd = r + rows;
            while (r < columnEnd)
            {
                result.data[r++] = visitor.apply (data[i]);
                i += strideR;
            }
            i += step;
        }
        return result;
    }

    /**
        Linear-algebra product this*B.
    **/
    public MatrixDense product (Matrix B) throws EvaluationException
    {
        int h = rows;
        int w = B.columns ();
        int m = columns;
        if (B.rows () != m) throw new EvaluationException ("Inner dimensions differ: " + h + "x" + m + " * " + B.rows () + "x" + w, this, B);
        MatrixDense result = new MatrixDense (h, w);
        int r = 0;
        for (int col = 0; col < w; col++)
        {
            int a = offset;
            for (int row = 0; row < h; row++)
            {
                double sum = 0;
                int i = a;
                for (int j = 0; j < m; j++)
                {
                    sum += data[i] * B.get (j, col);
                    i += strideC;
                }
                result.data[r++] = sum;
                a += strideR;
            }
        }
        return result;
    }

    /**
        Element-wise sum, as a MatrixDense. Shapes must match.
    **/
    public MatrixDense plus (Matrix B) throws EvaluationException
    {
        return (MatrixDense) combine (B, (a, b) -> a + b);
    }

    public MatrixDense scale (double scalar)
    {
        return visit (a -> a * scalar);
    }

    public double determinant () throws EvaluationException
    {
        if (rows != columns) throw new EvaluationException ("Can't compute determinant of non-square matrix.", this);
        if (rows == 1) return data[offset];
        if (rows == 2) return get (0, 0) * get (1, 1) - get (0, 1) * get (1, 0);
        if (rows == 3)
        {
            return   get (0, 0) * get (1, 1) * get (2, 2)
                   - get (0, 0) * get (1, 2) * get (2, 1)
                   - get (0, 1) * get (1, 0) * get (2, 2)
                   + get (0, 1) * get (1, 2) * get (2, 0)
                   + get (0, 2) * get (1, 0) * get (2, 1)
                   - get (0, 2) * get (1, 1) * get (2, 0);
        }
        throw new EvaluationException ("Can't compute determinant of matrices larger than 3x3.", this);
    }
}
