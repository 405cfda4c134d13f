package io.surfworks.tileforge.graph;

/**
 * Grid and block dimensions of a traced kernel launch.
 *
 * <p>The grid is what the kernel's grid loop iterates over: one iteration per
 * block. When tracing is off the launch runs its body once per block, passing
 * the linear block number.
 *
 * <p>Example:
 * <pre>{@code
 * // 2D launch: 16x8 blocks of 128 threads
 * LaunchConfig config = LaunchConfig.of2D(16, 8, 128, 1);
 * config.totalBlocks();   // 128
 * config.gridRank();      // 2
 * }</pre>
 *
 * @param gridDimX number of blocks in X dimension
 * @param gridDimY number of blocks in Y dimension
 * @param gridDimZ number of blocks in Z dimension
 * @param blockDimX threads per block in X dimension
 * @param blockDimY threads per block in Y dimension
 * @param blockDimZ threads per block in Z dimension
 * @param sharedMemBytes dynamic shared memory per block (bytes)
 */
public record LaunchConfig(
    int gridDimX,
    int gridDimY,
    int gridDimZ,
    int blockDimX,
    int blockDimY,
    int blockDimZ,
    int sharedMemBytes
) {
    /**
     * Single block of a single thread; used when a kernel is traced without
     * an explicit launch.
     */
    public static final LaunchConfig SINGLE = new LaunchConfig(1, 1, 1, 1, 1, 1, 0);

    public LaunchConfig {
        requirePositive("gridDimX", gridDimX);
        requirePositive("gridDimY", gridDimY);
        requirePositive("gridDimZ", gridDimZ);
        requirePositive("blockDimX", blockDimX);
        requirePositive("blockDimY", blockDimY);
        requirePositive("blockDimZ", blockDimZ);
        if (sharedMemBytes < 0) {
            throw new IllegalArgumentException("sharedMemBytes must be >= 0, got " + sharedMemBytes);
        }
    }

    /**
     * Creates a 1D launch configuration.
     *
     * @param gridSize total number of blocks
     * @param blockSize threads per block
     * @return a 1D launch configuration
     */
    public static LaunchConfig of1D(int gridSize, int blockSize) {
        return new LaunchConfig(gridSize, 1, 1, blockSize, 1, 1, 0);
    }

    /**
     * Creates a 2D launch configuration.
     *
     * @param gridDimX blocks in X
     * @param gridDimY blocks in Y
     * @param blockDimX threads per block in X
     * @param blockDimY threads per block in Y
     * @return a 2D launch configuration
     */
    public static LaunchConfig of2D(int gridDimX, int gridDimY, int blockDimX, int blockDimY) {
        return new LaunchConfig(gridDimX, gridDimY, 1, blockDimX, blockDimY, 1, 0);
    }

    /**
     * Returns the total number of blocks in the grid.
     */
    public long totalBlocks() {
        return (long) gridDimX * gridDimY * gridDimZ;
    }

    /**
     * Returns the number of grid dimensions in use: 3 if Z is non-trivial,
     * 2 if Y is, otherwise 1.
     */
    public int gridRank() {
        if (gridDimZ > 1) return 3;
        if (gridDimY > 1) return 2;
        return 1;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }

    @Override
    public String toString() {
        if (gridRank() == 1 && blockDimY == 1 && blockDimZ == 1) {
            return String.format("LaunchConfig[grid=%d, block=%d]", gridDimX, blockDimX);
        } else if (gridDimZ == 1 && blockDimZ == 1) {
            return String.format("LaunchConfig[grid=%dx%d, block=%dx%d]",
                gridDimX, gridDimY, blockDimX, blockDimY);
        } else {
            return String.format("LaunchConfig[grid=%dx%dx%d, block=%dx%dx%d]",
                gridDimX, gridDimY, gridDimZ, blockDimX, blockDimY, blockDimZ);
        }
    }
}
