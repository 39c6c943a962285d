package seqdist.clustering;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Square matrix of distances between named objects
 */
public class DistanceMatrix {
	
	public static final int MATRIX_TYPE_FULL = 0;
	public static final int MATRIX_TYPE_LOWER_LEFT = 1;
	public static final int MATRIX_TYPE_UPPER_RIGHT = 2;

	private List<String> ids;
	private double distanceMatrix[][];
	private int matrixOutputType = MATRIX_TYPE_FULL;
	
	/**
	 * Construct a DistanceMatrix object from two objects: a list with ids and 
	 * an array of double values which represent the distances.
	 * @param ids of the objects with the given distances
	 * @param distanceMatrix Values of distances between the objects
	*/
	public DistanceMatrix(List<String> ids, double distanceMatrix[][] ){
		if(ids.size()!=distanceMatrix.length) throw new IllegalArgumentException("Number of ids "+ids.size()+" does not match the matrix size "+distanceMatrix.length);
		for(double [] row:distanceMatrix) {
			if(row.length!=distanceMatrix.length) throw new IllegalArgumentException("Distance matrix must be square");
		}
		this.ids = Collections.unmodifiableList(new ArrayList<>(ids));
		this.distanceMatrix = distanceMatrix;
	}
	
	/**
	  * Print distance matrix.
	  * matrixType:
	  *  0 = full matrix
	  *  1 = Lower-left matrix
	  *  2 = Upper-right matrix
	  * @param out stream to print the matrix in generic format.
	*/
	public void printMatrix (PrintStream out) {
		//print number of samples of the matrix
		out.println(this.getNumSamples());
		for(int j=0;j<distanceMatrix.length;j++){
			StringBuilder row = new StringBuilder();
			for(int k=0;k<distanceMatrix[j].length;k++){
				if(matrixOutputType == MATRIX_TYPE_FULL || (matrixOutputType == MATRIX_TYPE_LOWER_LEFT && j>k) || (matrixOutputType == MATRIX_TYPE_UPPER_RIGHT && k>j) ) {
					row.append(" ");
					row.append(distanceMatrix[j][k]);
				}
			}
			out.println(ids.get(j)+row);
		}
	}
	
	/**
	 * @return the ids in the order of the rows of the matrix
	 */
	public List<String> getIds() {
		return ids;
	}
	
	/**
	 * @return a copy of the distance values
	 */
	public double[][] getDistanceMatrix() {
		double [][] answer = new double[distanceMatrix.length][];
		for(int i=0;i<distanceMatrix.length;i++) answer[i] = distanceMatrix[i].clone();
		return answer;
	}
	
	public double getDistance(int row, int column) {
		return distanceMatrix[row][column];
	}

	public int getNumSamples() {
		return distanceMatrix.length;
	}

	public int getMatrixType() {
		return matrixOutputType;
	}

	public void setMatrixOutputType(int matrixOutputType) {
		if(matrixOutputType<MATRIX_TYPE_FULL || matrixOutputType>MATRIX_TYPE_UPPER_RIGHT) throw new IllegalArgumentException("Unknown matrix type: "+matrixOutputType);
		this.matrixOutputType = matrixOutputType;
	}
	
}
